package com.sifinder.service;

/**
 * Message sent from a worker to the coordinator. Every event carries the slot and generation of
 * the request that produced it.
 */
public interface WorkerEvent {
    String slot();

    long generation();
}
