package com.segments.domain.schema;

import com.segments.config.ReportingProperties;
import com.segments.domain.exception.NotFoundException;
import com.segments.domain.model.TableColumns;
import com.segments.domain.model.TableName;
import com.segments.domain.model.WeekColumn;
import com.segments.infrastructure.cache.BoundedCache;
import com.segments.infrastructure.cache.EvictionPolicy;
import com.segments.infrastructure.cache.InsertionOrderEviction;
import com.segments.infrastructure.cache.LeastRecentlyUsedEviction;
import com.segments.infrastructure.store.ReportingStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Column and week catalogs per table, introspected once and cached.
 *
 * Schemas are assumed stable for the life of the process; entries only leave the
 * caches through eviction or shutdown.
 *
 * Cache Layout:
 * - columns: table -> introspected column names (ordinal order)
 * - weeks: table -> parsed week columns (ascending start date), derived from columns
 */
@Slf4j
@Service
public class SchemaCatalog {

    private final ReportingStore store;
    private final MeterRegistry meterRegistry;
    private final BoundedCache<TableName, TableColumns> columnCache;
    private final BoundedCache<TableName, List<WeekColumn>> weekCache;

    public SchemaCatalog(ReportingStore store, ReportingProperties properties, MeterRegistry meterRegistry) {
        this.store = store;
        this.meterRegistry = meterRegistry;
        ReportingProperties.SchemaCache settings = properties.getSchemaCache();
        this.columnCache = new BoundedCache<>("columns", settings.getCapacity(), evictionPolicy(settings));
        this.weekCache = new BoundedCache<>("weeks", settings.getCapacity(), evictionPolicy(settings));
    }

    /**
     * Physical column names of {@code table}.
     *
     * @throws com.segments.domain.exception.StoreException if introspection fails
     */
    public TableColumns columns(TableName table) {
        return columnCache.getOrCompute(table, this::introspect);
    }

    /**
     * Week columns of {@code table}, oldest first. May be empty.
     */
    public List<WeekColumn> weeks(TableName table) {
        return weekCache.getOrCompute(table, key -> WeekColumnParser.parse(columns(key).getNames()));
    }

    /**
     * Week columns of {@code table}; a table without any is reported as not found.
     */
    public List<WeekColumn> requireWeeks(TableName table) {
        List<WeekColumn> weeks = weeks(table);
        if (weeks.isEmpty()) {
            throw new NotFoundException("No weekly columns configured for table '" + table + "'.");
        }
        return weeks;
    }

    @PreDestroy
    public void close() {
        log.info("Clearing schema caches ({} tables)", columnCache.size());
        columnCache.clear();
        weekCache.clear();
    }

    private TableColumns introspect(TableName table) {
        Counter.builder("schema.cache")
                .tag("result", "miss")
                .register(meterRegistry)
                .increment();

        List<String> names = store.listColumns(table);
        log.info("Introspected table '{}': {} columns", table, names.size());
        return TableColumns.of(table, names);
    }

    private static <K> EvictionPolicy<K> evictionPolicy(ReportingProperties.SchemaCache settings) {
        return switch (settings.getEviction()) {
            case FIFO -> new InsertionOrderEviction<>();
            case LRU -> new LeastRecentlyUsedEviction<>();
        };
    }
}
