package com.eyelevel.bordereaux.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("blobStoreRetryListener")
@Slf4j
public class BlobStoreRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        if (context.getRetryCount() > 0) {
            log.warn("Blob read failed on attempt {}. Retrying...", context.getRetryCount(), throwable);
        }
    }
}
