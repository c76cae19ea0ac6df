package com.example.ingestion.service.handler;

import com.example.ingestion.config.WorkerProperties;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Shared infrastructure of all task handlers: the transaction manager and
 * the threads task bodies and their sub-steps run on.
 */
@Getter
@Component
public class TaskExecutionSupport {

    private final PlatformTransactionManager transactionManager;
    private final ExecutorService taskExecutor;
    private final ExecutorService stepExecutor;
    private final Duration rollbackGrace;

    @Autowired
    public TaskExecutionSupport(PlatformTransactionManager transactionManager,
                                @Qualifier("taskExecutionExecutor") ExecutorService taskExecutor,
                                @Qualifier("taskStepExecutor") ExecutorService stepExecutor,
                                WorkerProperties workerProperties) {
        this(transactionManager, taskExecutor, stepExecutor, Duration.ofSeconds(workerProperties.getRollbackGraceSeconds()));
    }

    public TaskExecutionSupport(PlatformTransactionManager transactionManager, ExecutorService taskExecutor,
                                ExecutorService stepExecutor, Duration rollbackGrace) {
        this.transactionManager = transactionManager;
        this.taskExecutor = taskExecutor;
        this.stepExecutor = stepExecutor;
        this.rollbackGrace = rollbackGrace;
    }

    public TransactionTemplate transaction() {
        return new TransactionTemplate(transactionManager);
    }

    public TransactionTemplate newTransaction() {
        var template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }
}
