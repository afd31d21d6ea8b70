package com.vidnyan.storytest.application.port.in;

import com.vidnyan.storytest.application.service.ProgressListener;
import com.vidnyan.storytest.application.service.RunControl;
import com.vidnyan.storytest.domain.model.AssemblyHandle;
import com.vidnyan.storytest.domain.report.ValidationReport;

import java.util.List;

/**
 * Primary use case: validate a set of loaded assemblies.
 */
public interface ValidateAssembliesUseCase {

    ValidationReport validate(ValidationRequest request);

    default ValidationReport validate(List<AssemblyHandle> assemblies) {
        return validate(ValidationRequest.forAssemblies(assemblies));
    }

    /**
     * Validation request parameters.
     */
    record ValidationRequest(
        List<AssemblyHandle> assemblies,
        RunControl control,
        ProgressListener listener
    ) {
        public static ValidationRequest forAssemblies(List<AssemblyHandle> assemblies) {
            return new ValidationRequest(assemblies, RunControl.create(), ProgressListener.NONE);
        }
    }
}
