package com.segments.domain.schema;

import com.segments.domain.model.Category;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Raw segment label to category key. Unknown labels pass through unchanged.
 */
@Component
public class CategoryMapper {

    private static final Map<String, Category> BY_LABEL = Arrays.stream(Category.values())
            .collect(Collectors.toUnmodifiableMap(Category::getLabel, Function.identity()));

    public String toCategory(String rawLabel) {
        return categoryOf(rawLabel).map(Category::getKey).orElse(rawLabel);
    }

    public Optional<Category> categoryOf(String rawLabel) {
        return rawLabel == null ? Optional.empty() : Optional.ofNullable(BY_LABEL.get(rawLabel));
    }
}
