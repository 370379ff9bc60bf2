package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.JobType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class JobHandlerRegistry {
    private final Map<JobType, JobHandler> map = new EnumMap<>(JobType.class);

    public JobHandlerRegistry(List<JobHandler> handlers) {
        for (JobHandler h : handlers) {
            JobHandler prev = map.put(h.type(), h);
            if (prev != null) {
                throw new IllegalStateException("duplicate handler for type=" + h.type().tag());
            }
        }
        List<JobType> missing = Arrays.stream(JobType.values())
                .filter(t -> !map.containsKey(t))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("no handler registered for " + missing);
        }
    }

    public JobHandler get(JobType type) { return map.get(type); }
}
