package io.creatorpay.cli;

import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "currency", description = "Check whether a currency code is supported")
public final class CurrencyCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "ISO currency code, e.g. USD")
    String code;

    public CurrencyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (context.store().supportsCurrency(normalized)) {
            System.out.println("'" + normalized + "' is a supported currency.");
            return 0;
        }
        System.out.println("'" + normalized + "' is invalid or not supported.");
        return 1;
    }
}
