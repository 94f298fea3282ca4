package com.transitgate.interfaces.cli;

import com.transitgate.application.quality.QualityGateAppService;
import com.transitgate.domain.quality.exception.QualityGateConfigurationException;
import com.transitgate.domain.quality.model.QualityGateResult;
import com.transitgate.infrastructure.io.DatasetLoadException;
import com.transitgate.infrastructure.quality.pipeline.QualityGatePipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch mode: {@code transit-quality-gate <dataset> [--reference=<name>=<path>]...}.
 * <p>
 * Exit status: 0 = PASS or PASS_WITH_WARNINGS, 1 = HALT, 2 = load, configuration, pipeline or output failure.
 * Any other {@code --quality-gate.*} option overrides the matching configuration property.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QualityGateCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_HALT = 1;
    static final int EXIT_FAILURE = 2;

    private static final String REFERENCE_OPTION = "reference";

    private final QualityGateAppService appService;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return;
        }
        if (positional.size() > 1) {
            log.error("[CLI] Exactly one dataset per run, got {}", positional);
            exitCode = EXIT_FAILURE;
            return;
        }

        try {
            Map<String, Path> references = parseReferences(args.getOptionValues(REFERENCE_OPTION));
            QualityGateResult result = appService.runFile(Path.of(positional.get(0)), references);
            exitCode = result.halted() ? EXIT_HALT : EXIT_OK;
            log.info("[CLI] {} -> {} (exit {})", positional.get(0), result.decision(), exitCode);
        } catch (DatasetLoadException e) {
            log.error("[CLI] Load failed: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        } catch (QualityGateConfigurationException e) {
            log.error("[CLI] Invalid configuration: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        } catch (QualityGatePipelineException | UncheckedIOException e) {
            log.error("[CLI] Run failed: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static Map<String, Path> parseReferences(List<String> values) {
        Map<String, Path> references = new LinkedHashMap<>();
        if (values == null) {
            return references;
        }
        for (String value : values) {
            int eq = value.indexOf('=');
            if (eq <= 0 || eq == value.length() - 1) {
                throw new QualityGateConfigurationException(
                        "--reference expects <name>=<path>, got '" + value + "'");
            }
            references.put(value.substring(0, eq).strip(), Path.of(value.substring(eq + 1).strip()));
        }
        return references;
    }
}
