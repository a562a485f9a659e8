package com.selectai.domain.common.service;

import com.selectai.domain.common.model.valobj.AttributeChangeSet;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 属性差异领域服务：比较替换前后的属性 Map。
 */
@Service
public class AttributeDiffDomainService {

    public AttributeChangeSet diff(Map<String, Object> before, Map<String, Object> after) {
        Map<String, Object> previous = before == null ? Collections.emptyMap() : before;
        Map<String, Object> next = after == null ? Collections.emptyMap() : after;
        Set<String> added = new LinkedHashSet<>();
        Set<String> changed = new LinkedHashSet<>();
        Set<String> removed = new LinkedHashSet<>();
        for (Map.Entry<String, Object> entry : next.entrySet()) {
            if (!previous.containsKey(entry.getKey())) {
                added.add(entry.getKey());
            } else if (!Objects.equals(previous.get(entry.getKey()), entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        for (String key : previous.keySet()) {
            if (!next.containsKey(key)) {
                removed.add(key);
            }
        }
        return new AttributeChangeSet(added, changed, removed);
    }
}
