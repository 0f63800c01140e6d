package com.example.notificationscheduler.mapper;

import com.example.notificationscheduler.dto.JobStatusResponse;
import com.example.notificationscheduler.service.registry.ScheduledJob;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper from in-memory job records to API views
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    JobStatusResponse toResponse(ScheduledJob job);
}
