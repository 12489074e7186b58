package com.fun.compute.api.service;

import com.fun.compute.api.model.CreateCommand;
import com.fun.compute.api.model.CreateResult;
import com.fun.compute.api.model.ImageRecord;
import com.fun.compute.api.model.InstanceActionRecord;
import com.fun.compute.api.model.InstanceRecord;
import com.fun.compute.api.model.RebootType;
import com.fun.compute.api.model.RebuildCommand;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.SearchOptions;
import com.fun.compute.api.model.UpdateCommand;

import java.util.List;
import java.util.Map;

/**
 * The compute service that owns instance state, scheduling, quotas and images.
 * <p>
 * Every method either returns or throws {@link com.fun.compute.api.exception.ComputeException};
 * nothing here retries.
 */
public interface ComputeClient {

    CreateResult create(RequestContext context, CreateCommand command);

    void update(RequestContext context, String instanceId, UpdateCommand command);

    void delete(RequestContext context, InstanceRecord instance);

    void softDelete(RequestContext context, InstanceRecord instance);

    void reboot(RequestContext context, InstanceRecord instance, RebootType type);

    void resize(RequestContext context, InstanceRecord instance, String flavorId);

    void confirmResize(RequestContext context, InstanceRecord instance);

    void revertResize(RequestContext context, InstanceRecord instance);

    void rebuild(RequestContext context, InstanceRecord instance, RebuildCommand command);

    ImageRecord snapshot(RequestContext context, InstanceRecord instance, String name,
                         Map<String, String> extraProperties);

    ImageRecord backup(RequestContext context, InstanceRecord instance, String name, String backupType,
                       int rotation, Map<String, String> extraProperties);

    void setAdminPassword(RequestContext context, InstanceRecord instance, String password);

    /**
     * Rejects image metadata with more items than the project may attach.
     */
    void checkImageMetadataQuota(RequestContext context, Map<String, String> metadata);

    List<InstanceRecord> getAll(RequestContext context, SearchOptions searchOptions);

    InstanceRecord routingGet(RequestContext context, String instanceId);

    Map<String, Object> getDiagnostics(RequestContext context, InstanceRecord instance);

    List<InstanceActionRecord> getActions(RequestContext context, InstanceRecord instance);
}
