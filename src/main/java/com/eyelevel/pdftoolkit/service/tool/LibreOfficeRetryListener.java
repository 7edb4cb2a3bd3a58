package com.eyelevel.pdftoolkit.service.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs failed PDF to Word attempts that are about to be retried.
 */
@Component
@Slf4j
public class LibreOfficeRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.warn("PDF to Word conversion attempt {} failed: {}", context.getRetryCount(), throwable.getMessage());
    }
}
