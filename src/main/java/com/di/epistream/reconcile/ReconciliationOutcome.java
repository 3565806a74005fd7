package com.di.epistream.reconcile;

import com.di.epistream.model.ReconciledFact;
import lombok.Value;

import java.util.List;

@Value
public class ReconciliationOutcome {
    /** One fact per (country, date), sorted by country then date. */
    List<ReconciledFact> facts;
    ReliabilityState nextState;
    List<ReconciliationAmbiguity> ambiguities;
}
