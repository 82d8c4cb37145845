package org.conflux.cli.commands;

import org.conflux.cli.CommandLineInterface;
import org.conflux.scenario.Scenario;
import org.conflux.scenario.ScenarioException;
import org.conflux.scenario.ScenarioLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "validate",
    description = "Checks a scenario for chains and recipes that can never run."
)
public class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "SCENARIO", description = "Scenario file (HOCON)")
    private File scenarioFile;

    @Override
    public Integer call() {
        parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Scenario scenario;
        try {
            scenario = ScenarioLoader.load(scenarioFile);
        } catch (ScenarioException e) {
            err.println(e.getMessage());
            return 1;
        }

        final List<String> problems = scenario.validate();
        if (problems.isEmpty()) {
            out.printf("%s: %d recipe(s), %d chain(s), %d converter(s), no problems found%n", scenario.name(),
                    scenario.recipes().size(), scenario.chains().size(), scenario.converters().size());
            return 0;
        }
        out.printf("%s: %d problem(s)%n", scenario.name(), problems.size());
        problems.forEach(problem -> out.println("  - " + problem));
        return 1;
    }
}
