package com.fun.compute.api.service;

import com.fun.compute.api.model.InstanceRecord;
import com.fun.compute.api.model.ServerDto;
import com.fun.compute.api.model.VmState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class ServerViewBuilder {

    public ServerDto minimal(InstanceRecord instance) {
        return ServerDto.minimal(instance.uuid(), instance.displayName());
    }

    public ServerDto detail(InstanceRecord instance) {
        List<ServerDto.SecurityGroupRef> securityGroups = instance.securityGroups() == null
                ? null
                : instance.securityGroups().stream().map(ServerDto.SecurityGroupRef::new).toList();
        return new ServerDto(
                instance.uuid(),
                instance.displayName(),
                status(instance),
                instance.projectId(),
                instance.userId(),
                instance.hostId(),
                instance.accessIpV4(),
                instance.accessIpV6(),
                instance.progress(),
                instance.imageRef() == null ? null : new ServerDto.Reference(instance.imageRef()),
                instance.flavorId() == null ? null : new ServerDto.Reference(instance.flavorId()),
                instance.metadata() == null ? Map.of() : instance.metadata(),
                securityGroups,
                instance.createdAt(),
                instance.updatedAt(),
                null
        );
    }

    private String status(InstanceRecord instance) {
        return VmState.fromValue(instance.vmState())
                .map(state -> state.statusFor(instance.taskState()))
                .orElse("UNKNOWN");
    }
}
