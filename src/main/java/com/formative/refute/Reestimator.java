package com.formative.refute;

import com.formative.data.Dataset;

import java.util.List;

/**
 * Re-runs the fitting procedure behind an original estimate on perturbed data.
 */
@FunctionalInterface
public interface Reestimator {

    /**
     * @param perturbed     the perturbed dataset
     * @param extraControls columns added by the perturbation, to be included as
     *                      controls on top of the original adjustment set
     * @return the new effect estimate
     */
    double estimate(Dataset perturbed, List<String> extraControls);
}
