package com.requirement.sync.reconcile;

import com.requirement.sync.action.ChangeAction;
import com.requirement.sync.action.Reference;
import com.requirement.sync.core.model.WorkItem;
import com.requirement.sync.metrics.MetricsService;
import com.requirement.sync.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Index from work item identity to the action that currently proposes its deletion.
 *
 * <p>A deletion proposed while diffing one folder is retracted once a later part
 * of the traversal finds the item under another parent. Scoped to one
 * reconciliation run.</p>
 */
public class DeletionLedger {
    private static final Logger log = LoggerFactory.getLogger(DeletionLedger.class);

    private final Map<String, Proposal> proposals = new HashMap<>();
    private final MetricsService metricsService;
    private int retractions;

    public DeletionLedger() {
        this(new NoOpMetricsService());
    }

    public DeletionLedger(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Records that {@code action} deletes {@code item} from {@code slot}.
     * The action must already carry the deletion.
     */
    public void propose(WorkItem item, ChangeAction action, String slot) {
        proposals.put(item.getId(), new Proposal(action, slot));
    }

    /**
     * Withdraws the proposed deletion of {@code item}, if any.
     *
     * @return true if a deletion was withdrawn
     */
    public boolean retract(WorkItem item) {
        Proposal proposal = proposals.remove(item.getId());
        if (proposal == null) {
            return false;
        }
        boolean removed = proposal.action().retractDeletion(proposal.slot(), Reference.concrete(item.getId()));
        if (removed) {
            retractions++;
            metricsService.incrementDeletionRetracted();
            log.debug("Retracted deletion of {} '{}' from {}", proposal.slot(), item.getIdentifier(),
                    proposal.action().getParent());
        }
        return removed;
    }

    /**
     * Number of proposed deletions still standing.
     */
    public int size() {
        return proposals.size();
    }

    public int getRetractions() {
        return retractions;
    }

    private record Proposal(ChangeAction action, String slot) {
    }
}
