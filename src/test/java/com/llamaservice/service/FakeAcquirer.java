package com.llamaservice.service;

import com.llamaservice.model.ModelDescriptor;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.DoubleConsumer;

/**
 * Scriptable acquirer: marks models present instead of touching the network.
 */
class FakeAcquirer implements ModelAcquirer {

    final List<String> downloads = new CopyOnWriteArrayList<>();
    final Set<String> present = ConcurrentHashMap.newKeySet();
    volatile boolean succeed = true;
    volatile RuntimeException failure;
    /** Runs at the start of every download, before any progress is reported. */
    volatile Runnable onDownload;

    @Override
    public boolean download(ModelDescriptor descriptor, DoubleConsumer onProgress) {
        downloads.add(descriptor.name());
        Runnable hook = onDownload;
        if (hook != null) {
            hook.run();
        }
        if (failure != null) {
            throw failure;
        }
        if (onProgress != null) {
            onProgress.accept(50.0);
            onProgress.accept(25.0);
            onProgress.accept(100.0);
        }
        if (succeed) {
            present.add(descriptor.name());
        }
        return succeed;
    }

    @Override
    public boolean isDownloaded(ModelDescriptor descriptor) {
        return present.contains(descriptor.name());
    }

    @Override
    public double progress(ModelDescriptor descriptor) {
        return present.contains(descriptor.name()) ? 100.0 : 0.0;
    }
}
