package com.foodtruck.common.dto;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * {@link PageRequest} that starts at an arbitrary row instead of a page boundary.
 */
public class OffsetPageRequest extends PageRequest {

    private final long offset;

    public OffsetPageRequest(long offset, int limit, Sort sort) {
        super((int) (offset / limit), limit, sort);
        this.offset = offset;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public PageRequest next() {
        return new OffsetPageRequest(offset + getPageSize(), getPageSize(), getSort());
    }

    @Override
    public PageRequest previous() {
        return hasPrevious()
                ? new OffsetPageRequest(Math.max(0, offset - getPageSize()), getPageSize(), getSort())
                : this;
    }

    @Override
    public PageRequest first() {
        return new OffsetPageRequest(0, getPageSize(), getSort());
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }

    @Override
    public Pageable previousOrFirst() {
        return previous();
    }

    @Override
    public PageRequest withSort(Sort sort) {
        return new OffsetPageRequest(offset, getPageSize(), sort);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OffsetPageRequest that)) return false;
        return offset == that.offset && super.equals(that);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Long.hashCode(offset);
    }
}
