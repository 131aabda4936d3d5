package com.shlawgathon.drawcheck.backend.orchestration;

import com.shlawgathon.drawcheck.backend.model.ValidationProgress;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> {
    };

    void onProgress(ValidationProgress progress);
}
