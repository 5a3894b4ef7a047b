package com.foodtruck.common.dto;

import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Offset/limit window requested by a list endpoint.
 *
 * <p>The offset is honoured exactly: {@code offset=1, limit=2} returns rows 2
 * and 3 even though that window does not start on a page boundary.</p>
 */
public record PageQuery(int offset, int limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (offset < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "offset must not be negative");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "limit must be between 1 and " + MAX_LIMIT);
        }
    }

    public static PageQuery of(int offset, int limit) {
        return new PageQuery(offset, limit);
    }

    public Pageable toPageable(Sort sort) {
        return new OffsetPageRequest(offset, limit, sort);
    }
}
