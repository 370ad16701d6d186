package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.FragmentStatus;
import com.openforge.gazetranslate.domain.FragmentType;
import com.openforge.gazetranslate.error.ValidationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.lang.Nullable;

/**
 * Filters, sort and page for {@link MemoryStore#queryFragments}. Null filters are ignored.
 */
public record FragmentQuery(
        @Nullable FragmentStatus status,
        @Nullable FragmentType   type,
        @Nullable String         sourceLang,
        @Nullable String         targetLang,
        @Nullable String         tag,
        @Nullable String         keyword,
        SortField                sortBy,
        Sort.Direction           direction,
        int                      page,
        int                      size
) {

    public static final int MAX_PAGE_SIZE = 200;

    public enum SortField {
        CREATED_AT("createTime"),
        LAST_ACCESSED_AT("lastAccessedAt"),
        ACCESS_COUNT("accessCount"),
        RETENTION_STRENGTH("retention.currentStrength");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        String property() {
            return property;
        }
    }

    public static FragmentQuery firstPage(int size) {
        return new FragmentQuery(null, null, null, null, null, null,
                SortField.CREATED_AT, Sort.Direction.DESC, 0, size);
    }

    Pageable pageable() {
        if (page < 0) {
            throw new ValidationException("page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("size must be within [1," + MAX_PAGE_SIZE + "]");
        }
        SortField field = sortBy != null ? sortBy : SortField.CREATED_AT;
        Sort.Direction dir = direction != null ? direction : Sort.Direction.DESC;
        return PageRequest.of(page, size, Sort.by(dir, field.property()).and(Sort.by(Sort.Direction.ASC, "id")));
    }
}
