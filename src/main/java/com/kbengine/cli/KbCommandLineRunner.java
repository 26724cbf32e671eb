package com.kbengine.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one command when the application starts with {@code app.cli.enabled=true}, then lets the
 * application exit with the command's status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cli.enabled", havingValue = "true")
public class KbCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final KbCommandLine commandLine;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        log.debug("Running command: {}", String.join(" ", args.getSourceArgs()));
        exitCode = commandLine.execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
