package io.creatorpay.cli;

import io.creatorpay.core.store.DbInfo;
import io.creatorpay.core.store.StoreAuditEntry;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "info", description = "Show store information and recent audit entries")
public final class InfoCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--logs", defaultValue = "3", description = "Number of audit entries to show")
    int logs;

    public InfoCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        DbInfo info = context.store().getDbInfo();
        System.out.println("Engine: " + info.engine() + " " + info.version());
        System.out.println("Records: " + context.store().count() + " / " + info.maxCapacity());
        System.out.println("Transactions supported: " + info.supportsTransactions());
        System.out.println("Thread safe: " + info.threadSafe());
        System.out.println("Recent audit entries:");
        for (StoreAuditEntry entry : context.store().getAuditLogs(logs)) {
            System.out.println("  " + entry);
        }
        return 0;
    }
}
