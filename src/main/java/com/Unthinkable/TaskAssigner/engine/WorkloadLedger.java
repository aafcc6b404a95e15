package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.EngineSettings.WorkloadMode;
import com.Unthinkable.TaskAssigner.engine.model.Person;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workload accumulator threaded through one sequential run. Starts from a roster snapshot and
 * records every increment so the caller can persist the deltas once the run is over.
 * Not thread-safe: one ledger belongs to one run.
 */
public class WorkloadLedger {

    private final WorkloadMode mode;
    private final Map<String, Person> members = new LinkedHashMap<>();
    private final Map<String, Integer> deltas = new LinkedHashMap<>();

    public WorkloadLedger(List<Person> roster, WorkloadMode mode) {
        this.mode = mode;
        for (Person p : roster) {
            if (members.putIfAbsent(p.id(), p) != null) {
                throw new IllegalArgumentException("Duplicate roster id: " + p.id());
            }
        }
    }

    /** Roster in its original order with current workloads. */
    public List<Person> current() {
        return new ArrayList<>(members.values());
    }

    public double workloadOf(String personId) {
        Person p = members.get(personId);
        if (p == null) {
            throw new IllegalArgumentException("Unknown person: " + personId);
        }
        return p.workload();
    }

    /**
     * Counts one more task against the person in {@link WorkloadMode#INTEGER_COUNT} mode. In
     * {@link WorkloadMode#NORMALIZED_LOAD} mode the load factor is caller-owned and left alone.
     */
    public void recordAssignment(String personId) {
        Person p = members.get(personId);
        if (p == null) {
            throw new IllegalArgumentException("Unknown person: " + personId);
        }
        if (mode != WorkloadMode.INTEGER_COUNT) {
            return;
        }
        members.put(personId, p.withWorkload(p.workload() + 1));
        deltas.merge(personId, 1, Integer::sum);
    }

    public Map<String, Integer> deltas() {
        return new LinkedHashMap<>(deltas);
    }
}
