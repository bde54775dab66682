package com.openlearn.collector.service.adapter;

import com.openlearn.collector.service.SourceDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * sourceKey → 어댑터. 스프링 빈으로 등록된 전용 어댑터가 범용 어댑터보다 우선합니다.
 */
@Component
@Slf4j
public class SourceAdapterRegistry {

    private final Map<String, SourceAdapter> adapters = new ConcurrentHashMap<>();
    private final SourceAdapterFactory factory;

    @Autowired
    public SourceAdapterRegistry(ObjectProvider<SourceAdapter> adapterBeans, SourceAdapterFactory factory) {
        this(adapterBeans.orderedStream().toList(), factory);
    }

    SourceAdapterRegistry(List<SourceAdapter> adapterBeans, SourceAdapterFactory factory) {
        this.factory = factory;
        for (SourceAdapter adapter : adapterBeans) {
            if (adapters.putIfAbsent(adapter.sourceKey(), adapter) != null) {
                throw new IllegalStateException("Duplicate adapter bean for source " + adapter.sourceKey());
            }
            log.info("Registered adapter {} for source {}", adapter.getClass().getSimpleName(), adapter.sourceKey());
        }
    }

    public SourceAdapter adapterFor(SourceDefinition source) {
        SourceAdapter adapter = adapters.computeIfAbsent(source.key(), key -> factory.create(source));
        if (adapter.kind() != source.kind()) {
            throw new IllegalStateException("Adapter for " + source.key() + " is " + adapter.kind()
                    + " but source is declared " + source.kind());
        }
        return adapter;
    }
}
