package com.formative.refute;

import com.formative.data.Dataset;

/**
 * One named robustness probe: perturbs the data, re-estimates and compares.
 */
public interface Refutation {

    String name();

    RefutationCheck run(Dataset data);
}
