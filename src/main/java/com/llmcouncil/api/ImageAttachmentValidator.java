package com.llmcouncil.api;

import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.council.model.ImageAttachment;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks image attachments before a turn is dispatched. Anything wrong is a 400.
 */
@Component
public class ImageAttachmentValidator {

    private static final Pattern DATA_URL = Pattern.compile("^data:([\\w.+-]+/[\\w.+-]+);base64,(.+)$", Pattern.DOTALL);
    private static final Set<String> SUPPORTED_TYPES = Set.of("image/png", "image/jpeg", "image/gif", "image/webp");

    private final CouncilProperties properties;

    public ImageAttachmentValidator(CouncilProperties properties) {
        this.properties = properties;
    }

    public List<ImageAttachment> validate(List<String> dataUrls) {
        if (dataUrls == null || dataUrls.isEmpty()) {
            return List.of();
        }
        if (dataUrls.size() > properties.getMaxImages()) {
            throw badRequest("At most " + properties.getMaxImages() + " images are allowed per message.");
        }
        List<ImageAttachment> attachments = new ArrayList<>(dataUrls.size());
        for (int index = 0; index < dataUrls.size(); index++) {
            attachments.add(decode(index + 1, dataUrls.get(index)));
        }
        return attachments;
    }

    private ImageAttachment decode(int position, String dataUrl) {
        if (dataUrl == null) {
            throw badRequest("Image " + position + " is empty.");
        }
        Matcher matcher = DATA_URL.matcher(dataUrl.trim());
        if (!matcher.matches()) {
            throw badRequest("Image " + position + " is not a base64 data URL.");
        }
        String mimeType = matcher.group(1).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_TYPES.contains(mimeType)) {
            throw badRequest("Image " + position + " has unsupported type " + mimeType + ".");
        }
        byte[] data;
        try {
            data = Base64.getMimeDecoder().decode(matcher.group(2));
        } catch (IllegalArgumentException ex) {
            throw badRequest("Image " + position + " is not valid base64.");
        }
        if (data.length == 0) {
            throw badRequest("Image " + position + " is empty.");
        }
        if (data.length > properties.getMaxImageBytes()) {
            throw badRequest("Image " + position + " exceeds " + properties.getMaxImageBytes() + " bytes.");
        }
        return new ImageAttachment(mimeType, data, dataUrl.trim());
    }

    private ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }
}
