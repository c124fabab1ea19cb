package io.creatorpay.cli;

import io.creatorpay.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the configuration file with store, processing and rule defaults")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace existing settings with defaults")
    boolean overwrite;

    @Option(names = "--show", description = "Print the resulting configuration")
    boolean show;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
        } catch (Exception e) {
            System.err.println("Could not write config " + context.configPath() + ": " + e.getMessage());
            return 1;
        }

        String action = result.createdConfig() ? "Created" : result.overwrittenConfig() ? "Reset to defaults" : "Kept existing settings in";
        System.out.println(action + " config: " + result.configPath());
        if (show) {
            try {
                System.out.println(context.configService().toPrettyJson(context.configService().load(result.configPath())));
            } catch (Exception e) {
                System.err.println("Could not read back config: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }
}
