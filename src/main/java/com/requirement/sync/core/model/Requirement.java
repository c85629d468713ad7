package com.requirement.sync.core.model;

/**
 * A leaf work item of the live graph.
 */
public class Requirement extends WorkItem {

    public Requirement(String identifier, String longName) {
        this(null, identifier, longName);
    }

    public Requirement(String id, String identifier, String longName) {
        super(id, identifier, longName);
    }

    @Override
    public boolean isFolder() {
        return false;
    }
}
