package com.repofactor.orchestrator.cli;

import com.repofactor.orchestrator.model.NextAction;
import com.repofactor.orchestrator.model.PipelineStage;
import com.repofactor.orchestrator.pipeline.DecisionFunction;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: decide --stage &lt;name&gt; [--retry-count &lt;n&gt;]
 * <p>
 * Prints the action the decision function picks for the given stage and
 * retry count. Runs without a Spring context or database.
 * <p>
 * Exit codes: 0 decided, 1 unknown stage, 2 usage error.
 */
@Command(name = "decide", mixinStandardHelpOptions = true,
        description = "Print the next pipeline action for a stage and retry count")
public class DecideCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--stage", required = true, description = "Current pipeline stage, e.g. implementation_failed")
    String stage;

    @Option(names = "--retry-count", defaultValue = "0", description = "Research cycles already run (default: ${DEFAULT-VALUE})")
    int retryCount;

    @Override
    public Integer call() {
        if (retryCount < 0) {
            throw new ParameterException(spec.commandLine(),
                    "--retry-count must not be negative, was " + retryCount);
        }
        if (PipelineStage.fromWireName(stage).isEmpty()) {
            spec.commandLine().getErr().println("Unknown stage '" + stage + "'. Expected one of: " + knownStages());
            return 1;
        }

        NextAction action = DecisionFunction.decide(stage, retryCount);
        spec.commandLine().getOut().println(action.wireName());
        return 0;
    }

    private static String knownStages() {
        return Arrays.stream(PipelineStage.values())
                .map(PipelineStage::wireName)
                .collect(Collectors.joining(", "));
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new DecideCommand()).execute(args));
    }
}
