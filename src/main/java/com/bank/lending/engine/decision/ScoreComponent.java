package com.bank.lending.engine.decision;

import com.bank.lending.model.ComponentType;
import com.bank.lending.model.MetricsBundle;

import java.util.List;
import java.util.Map;

/**
 * Supplies the named metric values one score component is banded on.
 * Band tables and penalties are configuration; a component only decides which
 * metric each configured name reads.
 */
public interface ScoreComponent {

    ComponentType getType();

    /** Metric names that band tables and penalties of this component may reference. */
    List<String> metricNames();

    /**
     * @return metric values keyed by name; a null value means the metric is undefined
     *         for this applicant and scores as the worst band
     */
    Map<String, Double> metricValues(MetricsBundle metrics);
}
