package io.creatorpay.core.store;

import io.creatorpay.core.config.model.StoreConfig;
import io.creatorpay.core.payment.CapacityExceededException;
import io.creatorpay.core.payment.Money;
import io.creatorpay.core.payment.PaymentKind;
import io.creatorpay.core.payment.PaymentRecord;
import io.creatorpay.core.payment.PaymentStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps every payment record in memory together with secondary indices by channel, status and period.
 *
 * <p>A single read/write lock guards the primary map and all indices, so an index entry
 * {@code index[key]} contains a record id exactly when the stored record's field equals {@code key}.
 * Records handed out by queries are live; mutate them through {@link #update(String, Consumer)} so the
 * indices follow.
 */
public final class InMemoryPaymentStore implements PaymentStore {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryPaymentStore.class);

    public static final String ENGINE = "InMemoryPaymentStore";
    public static final String VERSION = "1.0";
    public static final List<String> SUPPORTED_CURRENCIES = List.of("TRY", "USD", "EUR", "GBP");

    private final int maxCapacity;
    private final int auditLogLimit;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, PaymentRecord> records = new LinkedHashMap<>();
    private final Map<String, IndexKeys> indexed = new LinkedHashMap<>();
    private final Map<String, Set<String>> channelIndex = new TreeMap<>();
    private final Map<PaymentStatus, Set<String>> statusIndex = new EnumMap<>(PaymentStatus.class);
    private final Map<String, Set<String>> periodIndex = new TreeMap<>();
    private final Deque<StoreAuditEntry> auditLog = new ArrayDeque<>();

    public InMemoryPaymentStore() {
        this(StoreConfig.defaults(), Clock.systemUTC());
    }

    public InMemoryPaymentStore(StoreConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxCapacity = Math.max(1, config.maxCapacity());
        this.auditLogLimit = Math.max(1, config.auditLogLimit());
    }

    public static boolean validateCurrencyCode(String code) {
        if (code == null) {
            return false;
        }
        return SUPPORTED_CURRENCIES.contains(code.trim().toUpperCase(Locale.ROOT));
    }

    public static String formatMoney(double amount, String currency) {
        return Money.format(amount, currency);
    }

    public int maxCapacity() {
        return maxCapacity;
    }

    @Override
    public PaymentRecord save(PaymentRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return write(() -> {
            boolean exists = records.containsKey(record.id());
            if (!exists && records.size() >= maxCapacity) {
                LOG.warn("Rejected payment {}: capacity {} reached", record.id(), maxCapacity);
                throw new CapacityExceededException(maxCapacity);
            }
            records.put(record.id(), record);
            reindex(record);
            audit(exists ? StoreOperation.UPDATE : StoreOperation.INSERT, record.id(), record.kind().label());
            LOG.debug("Saved payment {} for channel {}", record.id(), record.channelId());
            return record;
        });
    }

    @Override
    public Optional<PaymentRecord> update(String id, Consumer<? super PaymentRecord> mutation) {
        Objects.requireNonNull(mutation, "mutation must not be null");
        return write(() -> {
            PaymentRecord record = id == null ? null : records.get(id);
            if (record == null) {
                return Optional.empty();
            }
            try {
                mutation.accept(record);
            } finally {
                reindex(record);
                audit(StoreOperation.UPDATE, id, "status=" + record.status());
            }
            return Optional.of(record);
        });
    }

    @Override
    public boolean delete(String id) {
        return write(() -> {
            PaymentRecord removed = id == null ? null : records.remove(id);
            if (removed == null) {
                return false;
            }
            IndexKeys keys = indexed.remove(id);
            if (keys != null) {
                removeFrom(channelIndex, keys.channelId(), id);
                removeFrom(statusIndex, keys.status(), id);
                removeFrom(periodIndex, keys.period(), id);
            }
            audit(StoreOperation.DELETE, id, removed.kind().label());
            return true;
        });
    }

    @Override
    public Optional<PaymentRecord> findById(String id) {
        Optional<PaymentRecord> found = read(() -> Optional.ofNullable(id == null ? null : records.get(id)));
        audit(StoreOperation.READ, id, found.isPresent() ? "" : "not found");
        return found;
    }

    @Override
    public List<PaymentRecord> findAll() {
        return read(() -> List.copyOf(records.values()));
    }

    @Override
    public List<PaymentRecord> findAllByChannel(String channelId) {
        String key = channelId == null ? "" : channelId.trim();
        return read(() -> resolve(channelIndex.get(key)));
    }

    @Override
    public List<PaymentRecord> findByStatus(PaymentStatus status) {
        return read(() -> resolve(status == null ? null : statusIndex.get(status)));
    }

    @Override
    public List<PaymentRecord> findByPeriod(String period) {
        String key = period == null ? "" : period.trim();
        return read(() -> resolve(periodIndex.get(key)));
    }

    @Override
    public List<PaymentRecord> findByDateRange(Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        return read(() -> records.values().stream()
            .filter(record -> !record.createdAt().isBefore(from) && !record.createdAt().isAfter(to))
            .toList());
    }

    @Override
    public List<PaymentRecord> findByAmountRange(double min, double max) {
        return read(() -> records.values().stream()
            .filter(record -> record.amount() >= min && record.amount() <= max)
            .toList());
    }

    @Override
    public List<PaymentRecord> getTopPayments(int limit) {
        int safeLimit = Math.max(0, limit);
        return read(() -> records.values().stream()
            .sorted(Comparator.comparingDouble(PaymentRecord::amount).reversed())
            .limit(safeLimit)
            .toList());
    }

    @Override
    public <T extends PaymentRecord> List<T> filterByType(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return read(() -> records.values().stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList());
    }

    @Override
    public List<PaymentRecord> filterByKind(PaymentKind kind) {
        return read(() -> records.values().stream()
            .filter(record -> record.kind() == kind)
            .toList());
    }

    @Override
    public int count() {
        return read(records::size);
    }

    @Override
    public BigDecimal getTotalVolume() {
        return read(() -> records.values().stream()
            .map(record -> BigDecimal.valueOf(record.amount()))
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP));
    }

    @Override
    public Map<PaymentStatus, Integer> getStatusDistribution() {
        return read(() -> {
            Map<PaymentStatus, Integer> distribution = new EnumMap<>(PaymentStatus.class);
            for (PaymentStatus status : PaymentStatus.values()) {
                Set<String> ids = statusIndex.get(status);
                distribution.put(status, ids == null ? 0 : ids.size());
            }
            return distribution;
        });
    }

    @Override
    public List<StoreAuditEntry> getAuditLogs(int limit) {
        int safeLimit = Math.max(0, limit);
        synchronized (auditLog) {
            List<StoreAuditEntry> all = new ArrayList<>(auditLog);
            return List.copyOf(all.subList(Math.max(0, all.size() - safeLimit), all.size()));
        }
    }

    @Override
    public boolean supportsCurrency(String code) {
        return validateCurrencyCode(code);
    }

    @Override
    public DbInfo getDbInfo() {
        return new DbInfo(ENGINE, VERSION, maxCapacity, false, true);
    }

    private void reindex(PaymentRecord record) {
        IndexKeys current = new IndexKeys(record.channelId(), record.status(), record.period());
        IndexKeys previous = indexed.put(record.id(), current);
        if (previous != null) {
            removeFrom(channelIndex, previous.channelId(), record.id());
            removeFrom(statusIndex, previous.status(), record.id());
            removeFrom(periodIndex, previous.period(), record.id());
        }
        channelIndex.computeIfAbsent(current.channelId(), key -> new LinkedHashSet<>()).add(record.id());
        statusIndex.computeIfAbsent(current.status(), key -> new LinkedHashSet<>()).add(record.id());
        periodIndex.computeIfAbsent(current.period(), key -> new LinkedHashSet<>()).add(record.id());
    }

    private <K> void removeFrom(Map<K, Set<String>> index, K key, String id) {
        Set<String> ids = index.get(key);
        if (ids == null) {
            return;
        }
        ids.remove(id);
        if (ids.isEmpty()) {
            index.remove(key);
        }
    }

    private List<PaymentRecord> resolve(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<PaymentRecord> resolved = new ArrayList<>(ids.size());
        for (String id : ids) {
            PaymentRecord record = records.get(id);
            if (record != null) {
                resolved.add(record);
            }
        }
        return List.copyOf(resolved);
    }

    private void audit(StoreOperation operation, String paymentId, String detail) {
        StoreAuditEntry entry = new StoreAuditEntry(clock.instant(), operation, paymentId, detail);
        synchronized (auditLog) {
            auditLog.addLast(entry);
            while (auditLog.size() > auditLogLimit) {
                auditLog.removeFirst();
            }
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private record IndexKeys(String channelId, PaymentStatus status, String period) {
    }
}
