package com.di.epistream.reconcile;

import com.di.epistream.model.CaseField;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Sources disagreed on a field and the best reliability scores were tied, so the value came
 * from the source-priority order. Recorded and logged, never thrown.
 *
 * @param candidates   source id -> reported value, sorted by source id
 * @param tiedSources  the sources sharing the top score, in priority order
 * @param chosenSource source whose value was kept
 */
public record ReconciliationAmbiguity(String countryCode,
                                      LocalDate date,
                                      CaseField field,
                                      Map<String, Long> candidates,
                                      List<String> tiedSources,
                                      String chosenSource) {
}
