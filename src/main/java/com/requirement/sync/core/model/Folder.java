package com.requirement.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A work item that owns child folders and requirements.
 */
public class Folder extends WorkItem implements WorkItemContainer {
    private final List<Folder> folders = new ArrayList<>();
    private final List<Requirement> requirements = new ArrayList<>();

    public Folder(String identifier, String longName) {
        this(null, identifier, longName);
    }

    public Folder(String id, String identifier, String longName) {
        super(id, identifier, longName);
    }

    @Override
    public boolean isFolder() {
        return true;
    }

    @Override
    public List<Folder> getFolders() {
        return Collections.unmodifiableList(folders);
    }

    @Override
    public List<Requirement> getRequirements() {
        return Collections.unmodifiableList(requirements);
    }

    @Override
    public void addFolder(Folder folder) {
        Containers.detach(folder);
        folders.add(folder);
        folder.setParent(this);
    }

    @Override
    public void addRequirement(Requirement requirement) {
        Containers.detach(requirement);
        requirements.add(requirement);
        requirement.setParent(this);
    }

    @Override
    public boolean removeChild(WorkItem child) {
        boolean removed = child.isFolder() ? folders.remove(child) : requirements.remove(child);
        if (removed) {
            child.setParent(null);
        }
        return removed;
    }
}
