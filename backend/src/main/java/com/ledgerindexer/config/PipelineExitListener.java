package com.ledgerindexer.config;

import com.ledgerindexer.domain.PipelineCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Exits the process once a bounded run is finished: 0 when every lane completed, 2 when some lane ended unhealthy.
 * Disabled with ledgerindexer.pipeline.exit-on-completion=false.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledgerindexer.pipeline", name = "exit-on-completion", havingValue = "true",
        matchIfMissing = true)
public class PipelineExitListener {

    public static final int EXIT_UNHEALTHY_LANES = 2;

    private final ApplicationContext applicationContext;

    @EventListener
    public void onPipelineCompleted(PipelineCompletedEvent event) {
        int exitCode = exitCode(event);
        log.info("Pipeline run finished, exiting with code {}", exitCode);
        // close on a separate thread: the event arrives on a lane thread the shutdown waits for
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, (ExitCodeGenerator) () -> exitCode)),
                "pipeline-exit");
        exit.start();
    }

    static int exitCode(PipelineCompletedEvent event) {
        return event.clean() ? 0 : EXIT_UNHEALTHY_LANES;
    }
}
