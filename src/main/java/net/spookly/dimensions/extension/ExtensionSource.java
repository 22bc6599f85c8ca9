package net.spookly.dimensions.extension;

import java.util.List;

/**
 * Discovery source for extensions; every call returns newly constructed instances.
 */
@FunctionalInterface
public interface ExtensionSource {
    ExtensionSource NONE = List::of;

    List<Extension> discover();
}
