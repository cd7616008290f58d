// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rule id to running task. Owned by the reconciliation tick, not thread-safe.
 */
public class ListenerRegistry {

    private final Map<Long, SupervisedTask> tasks = new LinkedHashMap<>();

    public void register(SupervisedTask task) {
        var previous = tasks.putIfAbsent(task.getRuleId(), task);
        if (previous != null) {
            throw new IllegalStateException("Rule " + task.getRuleId() + " already has a running listener");
        }
    }

    public Optional<SupervisedTask> remove(long ruleId) {
        return Optional.ofNullable(tasks.remove(ruleId));
    }

    public boolean contains(long ruleId) {
        return tasks.containsKey(ruleId);
    }

    public Set<Long> ruleIds() {
        return new LinkedHashSet<>(tasks.keySet());
    }

    public List<SupervisedTask> finishedTasks() {
        return tasks.values().stream().filter(SupervisedTask::isFinished).toList();
    }

    public List<SupervisedTask> tasks() {
        return new ArrayList<>(tasks.values());
    }

    public int size() {
        return tasks.size();
    }
}
