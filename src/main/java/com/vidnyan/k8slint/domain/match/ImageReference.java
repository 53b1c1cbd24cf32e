package com.vidnyan.k8slint.domain.match;

/**
 * Container image reference split into repository, tag and digest.
 * A registry port ({@code localhost:5000/app}) is not mistaken for a tag.
 */
public record ImageReference(String repository, String tag, String digest) {

    public static final String LATEST = "latest";

    public static ImageReference parse(String image) {
        String name = image;
        String digest = null;
        int at = image.indexOf('@');
        if (at >= 0) {
            name = image.substring(0, at);
            digest = image.substring(at + 1);
        }
        String tag = null;
        int colon = name.lastIndexOf(':');
        if (colon > name.lastIndexOf('/')) {
            tag = name.substring(colon + 1);
            name = name.substring(0, colon);
        }
        return new ImageReference(name, tag, digest);
    }

    /**
     * True for an explicit {@code :latest} tag, or for no tag and no digest (which pulls latest).
     */
    public boolean resolvesToLatest() {
        if (digest != null && !digest.isEmpty()) {
            return false;
        }
        return tag == null || tag.isEmpty() || LATEST.equals(tag);
    }

    /**
     * Pull policy Kubernetes would pick for this image: {@code Always} for latest, else {@code IfNotPresent}.
     */
    public String defaultPullPolicy() {
        return resolvesToLatest() ? "Always" : "IfNotPresent";
    }
}
