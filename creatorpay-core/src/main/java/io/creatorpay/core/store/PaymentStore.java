package io.creatorpay.core.store;

import io.creatorpay.core.payment.PaymentKind;
import io.creatorpay.core.payment.PaymentRecord;
import io.creatorpay.core.payment.PaymentStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

public interface PaymentStore {
    PaymentRecord save(PaymentRecord record);

    Optional<PaymentRecord> update(String id, Consumer<? super PaymentRecord> mutation);

    boolean delete(String id);

    Optional<PaymentRecord> findById(String id);

    List<PaymentRecord> findAll();

    List<PaymentRecord> findAllByChannel(String channelId);

    List<PaymentRecord> findByStatus(PaymentStatus status);

    List<PaymentRecord> findByPeriod(String period);

    List<PaymentRecord> findByDateRange(Instant from, Instant to);

    List<PaymentRecord> findByAmountRange(double min, double max);

    List<PaymentRecord> getTopPayments(int limit);

    <T extends PaymentRecord> List<T> filterByType(Class<T> type);

    List<PaymentRecord> filterByKind(PaymentKind kind);

    int count();

    BigDecimal getTotalVolume();

    Map<PaymentStatus, Integer> getStatusDistribution();

    List<StoreAuditEntry> getAuditLogs(int limit);

    boolean supportsCurrency(String code);

    DbInfo getDbInfo();
}
