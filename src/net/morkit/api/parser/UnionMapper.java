package net.morkit.api.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chooses among several Mappers by the name of the node being mapped.
 * This is the counterpart of a grammar rule with alternatives that produce
 * differently named nodes in the same place.
 */
public class UnionMapper<T> implements Mapper<T> {

    private final Map<String, Mapper<? extends T>> branches;

    public UnionMapper() {
        branches = new LinkedHashMap<String, Mapper<? extends T>>();
    }

    public Map<String, Mapper<? extends T>> getBranches() {
        return branches;
    }

    /**
     * Register the mapper for nodes called name.
     * Returns this instance for chaining.
     */
    public UnionMapper<T> add(String name, Mapper<? extends T> branch) {
        branches.put(name, branch);
        return this;
    }

    public T map(ParseTree tree) throws MappingException {
        Mapper<? extends T> branch = branches.get(tree.getName());
        if (branch == null)
            throw new MappingException("No mapping for parse tree node " +
                tree.getName() + " (expected one of " + branches.keySet() +
                ")");
        return branch.map(tree);
    }

}
