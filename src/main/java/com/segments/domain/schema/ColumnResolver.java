package com.segments.domain.schema;

import com.segments.domain.exception.SchemaException;
import com.segments.domain.model.LogicalField;
import com.segments.domain.model.TableColumns;
import org.springframework.stereotype.Component;

/**
 * Maps logical reporting fields to the physical column a table actually has.
 */
@Component
public class ColumnResolver {

    /**
     * First candidate spelling present in {@code columns}.
     *
     * @throws SchemaException if {@code required} and no candidate exists
     */
    public ResolvedColumn resolve(LogicalField field, TableColumns columns, boolean required) {
        for (String candidate : field.getCandidates()) {
            if (columns.contains(candidate)) {
                return ResolvedColumn.present(field, candidate);
            }
        }
        if (required) {
            throw new SchemaException(field.getDisplayName(), columns.getTable().value());
        }
        return ResolvedColumn.absent(field);
    }

    public ResolvedColumn require(LogicalField field, TableColumns columns) {
        return resolve(field, columns, true);
    }

    public ResolvedColumn optional(LogicalField field, TableColumns columns) {
        return resolve(field, columns, false);
    }
}
