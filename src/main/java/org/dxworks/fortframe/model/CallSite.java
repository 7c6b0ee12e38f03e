package org.dxworks.fortframe.model;

import java.util.List;
import java.util.Locale;

/**
 * A {@code call} statement target. The chain holds the component path for calls such as
 * {@code call grid%solver%run()}; the callee is its last element.
 */
public class CallSite {
    public final List<String> chain;
    public final Ref<Entity> target;

    public CallSite(List<String> chain) {
        this.chain = List.copyOf(chain);
        this.target = Ref.unresolved(chain.get(chain.size() - 1));
    }

    public String getName() {
        return target.getName();
    }

    public String chainKey() {
        return String.join("%", chain).toLowerCase(Locale.ROOT);
    }
}
