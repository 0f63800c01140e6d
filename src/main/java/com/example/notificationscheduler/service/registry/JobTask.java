package com.example.notificationscheduler.service.registry;

/**
 * Body of a scheduled job: a zero-argument operation that either returns
 * normally or throws.
 */
@FunctionalInterface
public interface JobTask {

    void run() throws Exception;
}
