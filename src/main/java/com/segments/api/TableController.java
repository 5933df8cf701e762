package com.segments.api;

import com.segments.domain.model.TableList;
import com.segments.domain.model.TableName;
import com.segments.domain.model.TablePreview;
import com.segments.domain.service.TableService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Table discovery and health.
 *
 * Endpoints:
 * - GET /api/v1/health - Ping the store
 * - GET /api/v1/tables - List tables of the active schema
 * - GET /api/v1/tables/{tableName} - Preview rows of a table
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TableController {

    private final TableService tableService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        tableService.checkHealth();
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @GetMapping("/tables")
    public ResponseEntity<TableList> listTables() {
        return ResponseEntity.ok(tableService.listTables());
    }

    /**
     * GET /api/v1/tables/{tableName}?limit=25
     *
     * limit: 1..100, default 25
     */
    @GetMapping("/tables/{tableName}")
    public ResponseEntity<TablePreview> previewTable(
            @PathVariable String tableName,
            @RequestParam(defaultValue = "25") @Min(1) @Max(100) int limit) {

        log.info("Preview table: table={}, limit={}", tableName, limit);

        return ResponseEntity.ok(tableService.preview(TableName.of(tableName), limit));
    }
}
