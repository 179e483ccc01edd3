package com.stockscan.db;

import com.stockscan.model.BarDaily;
import com.stockscan.model.DateRunRecord;
import com.stockscan.model.DateState;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.Instrument;
import com.stockscan.model.OrchestrationError;
import com.stockscan.model.StrategyResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed store used for dry runs and tests. A commit swaps the whole date partition under the write lock.
 */
public class InMemoryMarketStore implements MarketStore {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final NavigableMap<LocalDate, Partition> partitions = new TreeMap<>();
    private final Map<LocalDate, DateRunRecord> runs = new HashMap<>();
    private final Map<String, Instrument> universe = new LinkedHashMap<>();

    @Override
    public void commitDate(DateBatch batch) throws StoreException {
        batch.validate();
        Partition partition = new Partition(batch);
        lock.writeLock().lock();
        try {
            partitions.put(batch.date, partition);
            runs.put(batch.date, batch.run);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void recordFailedDate(LocalDate date, OrchestrationError cause, String message) {
        lock.writeLock().lock();
        try {
            runs.put(date, new DateRunRecord(date, DateState.FAILED, cause.name(), 0, 0, 0, 0, 0, message));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<BarDaily> getBars(String code, LocalDate from, LocalDate to) {
        lock.readLock().lock();
        try {
            List<BarDaily> out = new ArrayList<>();
            for (Partition partition : partitions.subMap(from, true, to, true).values()) {
                BarDaily bar = partition.bars.get(code);
                if (bar != null) {
                    out.add(bar);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<BarDaily> getRecentBars(String code, LocalDate before, int limit) {
        lock.readLock().lock();
        try {
            List<BarDaily> desc = new ArrayList<>();
            for (Partition partition : partitions.headMap(before, false).descendingMap().values()) {
                if (desc.size() >= limit) {
                    break;
                }
                BarDaily bar = partition.bars.get(code);
                if (bar != null) {
                    desc.add(bar);
                }
            }
            List<BarDaily> asc = new ArrayList<>(desc.size());
            for (int i = desc.size() - 1; i >= 0; i--) {
                asc.add(desc.get(i));
            }
            return asc;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<IndicatorRow> getIndicators(String code, LocalDate date) {
        lock.readLock().lock();
        try {
            Partition partition = partitions.get(date);
            return partition == null ? Optional.empty() : Optional.ofNullable(partition.rows.get(code));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StrategyResult> getStrategyResults(LocalDate date, Optional<String> strategy) {
        lock.readLock().lock();
        try {
            Partition partition = partitions.get(date);
            List<StrategyResult> out = new ArrayList<>();
            if (partition == null) {
                return out;
            }
            for (StrategyResult result : partition.results) {
                if (strategy.isEmpty() || strategy.get().equals(result.strategy)) {
                    out.add(result);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StrategyResult> getStrategyResults(LocalDate from, LocalDate to) {
        lock.readLock().lock();
        try {
            List<StrategyResult> out = new ArrayList<>();
            for (Partition partition : partitions.subMap(from, true, to, true).values()) {
                out.addAll(partition.results);
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<DateRunRecord> getDateRun(LocalDate date) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(runs.get(date));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Instrument> listUniverse() {
        lock.readLock().lock();
        try {
            List<Instrument> out = new ArrayList<>(universe.values());
            out.sort(Comparator.comparing(i -> i.code));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void replaceUniverse(List<Instrument> instruments) throws StoreException {
        Map<String, Instrument> next = new LinkedHashMap<>();
        for (Instrument instrument : instruments) {
            if (next.put(instrument.code, instrument) != null) {
                throw new StoreException(StoreError.CONSTRAINT_VIOLATION, "duplicate universe code " + instrument.code);
            }
        }
        lock.writeLock().lock();
        try {
            universe.clear();
            universe.putAll(next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Number of bars stored for the date; 0 when the date has no partition.
     */
    public int barCount(LocalDate date) {
        lock.readLock().lock();
        try {
            Partition partition = partitions.get(date);
            return partition == null ? 0 : partition.bars.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int indicatorRowCount(LocalDate date) {
        lock.readLock().lock();
        try {
            Partition partition = partitions.get(date);
            return partition == null ? 0 : partition.rows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final class Partition {
        final Map<String, BarDaily> bars = new HashMap<>();
        final Map<String, IndicatorRow> rows = new HashMap<>();
        final List<StrategyResult> results;

        Partition(DateBatch batch) {
            for (BarDaily bar : batch.bars) {
                bars.put(bar.code, bar);
            }
            for (IndicatorRow row : batch.indicatorRows) {
                rows.put(row.code, row);
            }
            List<StrategyResult> sorted = new ArrayList<>(batch.results);
            sorted.sort(StrategyResult.REPORT_ORDER);
            this.results = List.copyOf(sorted);
        }
    }
}
