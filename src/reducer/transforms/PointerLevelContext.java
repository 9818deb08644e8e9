package reducer.transforms;

import reducer.hir.VariableDeclarator;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
* Analysis state of one pointer-level reduction run. All declarators held
* here are canonical declarators. Sets keep the registration order, which
* fixes the numbering of the transformation instances.
*/
public class PointerLevelContext {

    /** Indirection level to the declarators registered at that level */
    private Map<Integer, LinkedHashSet<VariableDeclarator>> registry;

    private Set<VariableDeclarator> valid_decls;

    private Set<VariableDeclarator> address_taken_decls;

    private int max_indirect_level;

    public PointerLevelContext() {
        registry = new HashMap<Integer, LinkedHashSet<VariableDeclarator>>();
        valid_decls = new LinkedHashSet<VariableDeclarator>();
        address_taken_decls = new LinkedHashSet<VariableDeclarator>();
        max_indirect_level = 0;
    }

    /** Checks if the declarator has been registered at any level. */
    public boolean isRegistered(VariableDeclarator d) {
        for (Set<VariableDeclarator> decls : registry.values()) {
            if (decls.contains(d)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Registers a declarator at the given level and marks it valid.
    *
    * @param d the canonical declarator.
    * @param level the indirection level, at least 1.
    * @throws InternalError if the level is not positive.
    */
    public void register(VariableDeclarator d, int level) {
        if (level <= 0) {
            throw new InternalError("Invalid indirect level " + level +
                    " for " + d.getSymbolName());
        }
        LinkedHashSet<VariableDeclarator> decls = registry.get(level);
        if (decls == null) {
            decls = new LinkedHashSet<VariableDeclarator>();
            registry.put(level, decls);
        }
        decls.add(d);
        valid_decls.add(d);
        if (level > max_indirect_level) {
            max_indirect_level = level;
        }
    }

    /** Removes a declarator from the valid set; it is never re-added. */
    public void invalidate(VariableDeclarator d) {
        valid_decls.remove(d);
    }

    public void addAddressTaken(VariableDeclarator d) {
        address_taken_decls.add(d);
    }

    public boolean isValid(VariableDeclarator d) {
        return valid_decls.contains(d);
    }

    public boolean isAddressTaken(VariableDeclarator d) {
        return address_taken_decls.contains(d);
    }

    /**
    * Returns the declarators registered at the given level in registration
    * order; empty if none.
    */
    public Set<VariableDeclarator> getDeclarators(int level) {
        Set<VariableDeclarator> decls = registry.get(level);
        if (decls == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(decls);
    }

    public Set<VariableDeclarator> getValidDeclarators() {
        return Collections.unmodifiableSet(valid_decls);
    }

    public Set<VariableDeclarator> getAddressTakenDeclarators() {
        return Collections.unmodifiableSet(address_taken_decls);
    }

    public int getMaxIndirectLevel() {
        return max_indirect_level;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        sb.append("max level ").append(max_indirect_level);
        for (int level = max_indirect_level; level > 0; level--) {
            sb.append(", level ").append(level).append(": ");
            sb.append(getDeclarators(level).size());
        }
        sb.append(", valid ").append(valid_decls.size());
        sb.append(", address-taken ").append(address_taken_decls.size());
        return sb.toString();
    }

}
