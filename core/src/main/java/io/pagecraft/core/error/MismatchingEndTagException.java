package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when an end tag names a different block than the one it would close. */
public final class MismatchingEndTagException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    private final Location blockLocation;

    public MismatchingEndTagException(
            String endBody, Location location, String expectedKeyword, String blockBody, Location blockLocation) {
        super(
                "The end tag '{% " + endBody + " %}' at " + location + " should be '{% end" + expectedKeyword
                        + " %}', as it corresponds to the block tag '{% " + blockBody + " %}' at " + blockLocation
                        + ".",
                location);
        this.blockLocation = blockLocation;
    }

    /** Position of the block the end tag would have closed. */
    public Location blockLocation() {
        return blockLocation;
    }
}
