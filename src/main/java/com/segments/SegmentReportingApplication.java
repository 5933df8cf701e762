package com.segments;

import com.segments.config.ReportingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Segment Reporting Backend
 *
 * Reporting API over a wide user table: one row per user, descriptive columns
 * (segment, contact details, balances) and one activity column per week, named
 * after its date range.
 *
 * Architecture:
 * - Schema catalog: columns and week columns introspected once per table, bounded cache
 * - Column resolution: logical fields matched against several physical spellings
 * - Query compiler: identifiers from validated/introspected names, values always bound
 * - Report services: run the aggregates and reshape rows into typed responses
 * - Redis caching for whole-table breakdowns
 */
@SpringBootApplication
@EnableConfigurationProperties(ReportingProperties.class)
public class SegmentReportingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SegmentReportingApplication.class, args);
    }
}
