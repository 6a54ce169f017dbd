package com.e2eq.skos.core;

import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.List;

/**
 * Adds a missing {@code skos:broader} link from a coded concept to its nearest
 * existing code-prefix parent, when none of its declared broader targets is one of
 * its prefix parents.
 */
public final class HierarchyAutofixer {

    private static final Logger LOG = Logger.getLogger(HierarchyAutofixer.class);

    /**
     * @return the number of broader links added
     */
    public int apply(List<Concept> concepts, CleaningRun run) {
        HierarchyIndex index = HierarchyIndex.of(concepts);
        if (index.isEmpty()) return 0;

        int added = 0;
        for (Concept concept : concepts) {
            String code = index.codeOf(concept.uri()).orElse(null);
            if (code == null) continue;
            List<String> candidates = index.existingCandidates(code);
            if (candidates.isEmpty()) continue;
            if (!Collections.disjoint(index.broaderCodes(code), candidates)) continue;

            // candidates are ordered longest first
            String parentCode = candidates.get(0);
            String parentUri = index.uriOf(parentCode).orElseThrow();
            String statement = HierarchyIndex.BROADER + " <" + parentUri + ">";
            if (concept.otherProperties().contains(statement)) continue;

            concept.addOtherProperty(statement);
            added++;
            run.logChange("Autofix: added skos:broader <" + parentUri + "> to <" + concept.uri() + "> based on code " + code);
            LOG.debugf("Added skos:broader <%s> to <%s> (code %s)", parentUri, concept.uri(), code);
        }
        run.add(Statistic.BROADER_LINKS_ADDED, added);
        return added;
    }
}
