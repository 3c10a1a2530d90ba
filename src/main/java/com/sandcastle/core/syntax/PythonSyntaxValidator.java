package com.sandcastle.core.syntax;

import com.sandcastle.channel.FailureClass;
import com.sandcastle.channel.WorkerOutcome;
import com.sandcastle.core.model.CodeExecutionException;
import com.sandcastle.sandbox.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates submissions with the same Python interpreter that runs them. A worker
 * compiles the source to a code object that is discarded; nothing is executed.
 */
@Service
public class PythonSyntaxValidator implements SyntaxValidator {

    private static final Logger log = LoggerFactory.getLogger(PythonSyntaxValidator.class);

    private final WorkerSupervisor supervisor;

    public PythonSyntaxValidator(WorkerSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public void validate(String code) {
        WorkerOutcome outcome = supervisor.compile(code == null ? "" : code);
        if (outcome instanceof WorkerOutcome.Failure failure) {
            if (failure.errorClass() != FailureClass.SYNTAX) {
                throw CodeExecutionException.internal("Syntax check failed: " + failure.errorMessage());
            }
            log.debug("Rejected submission: {}", failure.errorMessage());
            throw CodeExecutionException.syntax(failure.errorMessage());
        }
    }
}
