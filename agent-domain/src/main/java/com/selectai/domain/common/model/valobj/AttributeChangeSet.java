package com.selectai.domain.common.model.valobj;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 两份属性记录之间的差异。
 */
@Getter
public final class AttributeChangeSet {

    private final Set<String> added;

    private final Set<String> changed;

    private final Set<String> removed;

    public AttributeChangeSet(Set<String> added, Set<String> changed, Set<String> removed) {
        this.added = Collections.unmodifiableSet(new LinkedHashSet<>(added));
        this.changed = Collections.unmodifiableSet(new LinkedHashSet<>(changed));
        this.removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
    }

    public boolean isEmpty() {
        return added.isEmpty() && changed.isEmpty() && removed.isEmpty();
    }

    /**
     * 新增与变更的属性名，按出现顺序。
     */
    public Set<String> modifiedKeys() {
        Set<String> keys = new LinkedHashSet<>(added);
        keys.addAll(changed);
        return keys;
    }

    @Override
    public String toString() {
        return "added=" + added + ", changed=" + changed + ", removed=" + removed;
    }
}
