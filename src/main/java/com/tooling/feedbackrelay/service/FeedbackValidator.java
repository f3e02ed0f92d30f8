package com.tooling.feedbackrelay.service;

import com.tooling.feedbackrelay.config.FeedbackRelayProperties;
import com.tooling.feedbackrelay.exception.FeedbackValidationException;
import com.tooling.feedbackrelay.model.session.FeedbackSubmission;
import com.tooling.feedbackrelay.model.session.ImageAttachment;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks raw feedback before it reaches the session store. Nothing is mutated
 * when validation fails. Image sizes in the returned submission are the
 * decoded byte counts, not whatever the client claimed.
 */
@Component
@Slf4j
public class FeedbackValidator {

    static final Set<String> SUPPORTED_IMAGE_TYPES =
            Set.of("image/png", "image/jpeg", "image/jpg", "image/gif", "image/bmp", "image/webp");

    /** Per-submission override sent by the UI in {@code settings}. */
    static final String IMAGE_SIZE_LIMIT_SETTING = "image_size_limit";

    private final FeedbackRelayProperties.Validation limits;

    public FeedbackValidator(FeedbackRelayProperties properties) {
        this.limits = properties.getValidation();
    }

    public FeedbackSubmission validate(String feedbackText, List<ImageAttachment> images, Map<String, Object> settings) {
        List<String> violations = new ArrayList<>();
        String text = feedbackText == null ? "" : feedbackText;
        if (text.length() > limits.getMaxFeedbackLength()) {
            violations.add("Feedback exceeds " + limits.getMaxFeedbackLength() + " characters");
        }

        List<ImageAttachment> attachments = images == null ? List.of() : images;
        if (attachments.size() > limits.getMaxImages()) {
            violations.add("At most " + limits.getMaxImages() + " images may be attached, got " + attachments.size());
        }

        long sizeLimit = imageSizeLimit(settings);
        List<ImageAttachment> normalized = new ArrayList<>();
        for (int i = 0; i < attachments.size(); i++) {
            ImageAttachment image = attachments.get(i);
            if (image == null) {
                violations.add("Image #" + (i + 1) + " is empty");
                continue;
            }
            String label = StringUtils.defaultIfBlank(image.getName(), "#" + (i + 1));
            if (StringUtils.isBlank(image.getName())) {
                violations.add("Image " + label + " has no name");
            }
            if (image.getType() != null && !SUPPORTED_IMAGE_TYPES.contains(image.getType().toLowerCase(Locale.ROOT))) {
                violations.add("Image " + label + " has unsupported type " + image.getType());
            }
            byte[] decoded = decode(image.getData());
            if (decoded == null) {
                violations.add("Image " + label + " is not valid base64");
                continue;
            }
            if (decoded.length == 0) {
                violations.add("Image " + label + " has no data");
                continue;
            }
            if (sizeLimit > 0 && decoded.length > sizeLimit) {
                violations.add("Image " + label + " is " + decoded.length + " bytes, limit is " + sizeLimit);
                continue;
            }
            normalized.add(image.toBuilder().size(decoded.length).build());
        }

        if (!violations.isEmpty()) {
            log.warn("Rejected feedback submission: {}", violations);
            throw new FeedbackValidationException(violations);
        }
        return new FeedbackSubmission(text, normalized, settings);
    }

    private long imageSizeLimit(Map<String, Object> settings) {
        if (settings != null && settings.get(IMAGE_SIZE_LIMIT_SETTING) instanceof Number) {
            return ((Number) settings.get(IMAGE_SIZE_LIMIT_SETTING)).longValue();
        }
        return limits.getMaxImageSizeBytes();
    }

    private static byte[] decode(String data) {
        if (data == null) {
            return new byte[0];
        }
        String payload = data;
        // data URLs from the browser: "data:image/png;base64,...."
        int comma = payload.indexOf(',');
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        try {
            return Base64.getDecoder().decode(StringUtils.deleteWhitespace(payload));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
