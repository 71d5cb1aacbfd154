package io.stackwarden.stack.model;

/**
 * Image name split from its tag and content digest. A colon only separates a tag when it follows
 * the last path separator, so registry ports ({@code registry:5000/app}) stay part of the name.
 * A pinned reference ({@code app@sha256:...}) may carry no tag at all; the digest is what gets
 * pulled and run.
 */
public record ImageReference(String name, String tag, String digest) {

    public static final String DEFAULT_TAG = "latest";

    public ImageReference {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("image name must not be blank");
        }
        digest = digest == null || digest.isBlank() ? null : digest;
        if (tag == null || tag.isBlank()) {
            tag = digest == null ? DEFAULT_TAG : null;
        }
    }

    public ImageReference(String name, String tag) {
        this(name, tag, null);
    }

    public static ImageReference parse(String image, String fallbackTag) {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image must not be blank");
        }
        String trimmed = image.trim();
        String digest = null;
        int at = trimmed.indexOf('@');
        if (at >= 0) {
            digest = trimmed.substring(at + 1);
            trimmed = trimmed.substring(0, at);
            if (digest.indexOf(':') <= 0) {
                throw new IllegalArgumentException("malformed image digest in " + image);
            }
        }
        int lastSlash = trimmed.lastIndexOf('/');
        int lastColon = trimmed.lastIndexOf(':');
        if (lastColon > lastSlash) {
            return new ImageReference(trimmed.substring(0, lastColon), trimmed.substring(lastColon + 1), digest);
        }
        return new ImageReference(trimmed, digest == null ? fallbackTag : null, digest);
    }

    public boolean pinned() {
        return digest != null;
    }

    /**
     * Value handed to the registry when pulling: the digest for pinned images, else the tag.
     */
    public String pullTag() {
        return digest != null ? digest : tag;
    }

    /**
     * Reference a container is created from. Pinned images resolve by digest alone.
     */
    public String runReference() {
        return digest != null ? name + "@" + digest : name + ":" + tag;
    }

    /**
     * Registry host of the image, or {@code null} for Docker Hub images.
     */
    public String registryHost() {
        int slash = name.indexOf('/');
        if (slash < 0) {
            return null;
        }
        String first = name.substring(0, slash);
        if (first.contains(".") || first.contains(":") || "localhost".equals(first)) {
            return first;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (tag != null) {
            sb.append(':').append(tag);
        }
        if (digest != null) {
            sb.append('@').append(digest);
        }
        return sb.toString();
    }
}
