package io.creatorpay.cli;

import io.creatorpay.core.payment.PaymentRecord;
import io.creatorpay.core.payment.PaymentStatus;
import io.creatorpay.core.service.ProcessResult;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "process", description = "Simulate bank processing of pending payments")
public final class ProcessCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--channel", description = "Only process payments of this channel")
    String channelId;

    public ProcessCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        List<PaymentRecord> pending = channelId == null
            ? context.store().findByStatus(PaymentStatus.PENDING)
            : context.revenueService().filterPaymentsByStatus(channelId, PaymentStatus.PENDING);
        int succeeded = 0;
        for (PaymentRecord record : pending) {
            ProcessResult result = context.revenueService().simulatePaymentProcessing(record.id());
            if (result.success()) {
                succeeded++;
            }
            System.out.println(record.channelId() + " " + record.id() + ": " + result.message());
        }
        System.out.println("Processed " + pending.size() + " payments, " + succeeded + " succeeded.");
        return 0;
    }
}
