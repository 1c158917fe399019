package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.Resource;

/** A resource able to fill a role, with its catalog priority for that role. */
public record RoleCandidate(Resource resource, int catalogPriority) {

    public Long resourceId() {
        return resource.getId();
    }
}
