package com.fastalert.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 告警管线指标出口
 * 宿主注册表 (含嵌套 Composite) 展平去重后合入; 宿主没有注册表时退回内存 Simple
 * 所有指标带 component=alert-wheel 标签
 */
public class AlertMeterRegistryProvider {

    public static final String COMPONENT_TAG = "component";

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public AlertMeterRegistryProvider(List<MeterRegistry> discovered) {
        Set<MeterRegistry> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        if (discovered != null) {
            discovered.forEach(r -> flatten(r, seen));
        }
        if (seen.isEmpty()) {
            composite.add(new SimpleMeterRegistry());
        } else {
            seen.forEach(composite::add);
        }
        composite.config().commonTags(COMPONENT_TAG, "alert-wheel");
    }

    private static void flatten(MeterRegistry r, Set<MeterRegistry> out) {
        if (r instanceof CompositeMeterRegistry c) {
            c.getRegistries().forEach(child -> flatten(child, out));
        } else if (r != null) {
            out.add(r);
        }
    }

    public MeterRegistry getRegistry() {
        return composite;
    }
}
