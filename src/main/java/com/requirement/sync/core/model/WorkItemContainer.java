package com.requirement.sync.core.model;

import java.util.List;

/**
 * A node of the live graph that owns folders and requirements:
 * either the {@link Module} root or a {@link Folder}.
 */
public interface WorkItemContainer {

    String getId();

    List<Folder> getFolders();

    List<Requirement> getRequirements();

    void addFolder(Folder folder);

    void addRequirement(Requirement requirement);

    /**
     * Detaches the given child. Returns false if it was not a direct child.
     */
    boolean removeChild(WorkItem child);
}
