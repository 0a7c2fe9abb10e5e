package com.vbaflow.analyzer.static_analysis;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Module name -> declared procedure names, for every module of a project folder.
 *
 * Lookups are case-insensitive, as VBA identifiers are. Iteration is alphabetical so that
 * resolution by scanning all modules is deterministic. Read-only once built.
 */
public class SymbolTable {

    private final Map<String, Set<String>> proceduresByModule =
        new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * Records a module and its declared procedures. A module added twice keeps the union.
     */
    void add(String moduleName, Set<String> procedures) {
        Set<String> set = proceduresByModule.computeIfAbsent(
            moduleName, k -> new TreeSet<>(String.CASE_INSENSITIVE_ORDER));
        set.addAll(procedures);
    }

    public static SymbolTable of(Map<String, Set<String>> entries) {
        SymbolTable table = new SymbolTable();
        entries.forEach(table::add);
        return table;
    }

    public static SymbolTable empty() {
        return new SymbolTable();
    }

    public Set<String> modules() {
        return Collections.unmodifiableSet(proceduresByModule.keySet());
    }

    public Set<String> procedures(String moduleName) {
        Set<String> set = proceduresByModule.get(moduleName);
        return set != null ? Collections.unmodifiableSet(set) : Collections.emptySet();
    }

    public boolean hasModule(String moduleName) {
        return proceduresByModule.containsKey(moduleName);
    }

    public boolean declares(String moduleName, String procedure) {
        Set<String> set = proceduresByModule.get(moduleName);
        return set != null && set.contains(procedure);
    }

    /**
     * The module name as declared (original casing), if known.
     */
    public Optional<String> canonicalModuleName(String moduleName) {
        for (String name : proceduresByModule.keySet()) {
            if (name.equalsIgnoreCase(moduleName)) return Optional.of(name);
        }
        return Optional.empty();
    }

    /**
     * First module (alphabetically) declaring {@code procedure}.
     */
    public Optional<String> findDeclaringModule(String procedure) {
        for (Map.Entry<String, Set<String>> entry : proceduresByModule.entrySet()) {
            if (entry.getValue().contains(procedure)) return Optional.of(entry.getKey());
        }
        return Optional.empty();
    }

    /**
     * The procedure name as declared in {@code moduleName} (original casing), or the input.
     */
    public String canonicalProcedureName(String moduleName, String procedure) {
        for (String declared : procedures(moduleName)) {
            if (declared.equalsIgnoreCase(procedure)) return declared;
        }
        return procedure;
    }

    public int size() {
        return proceduresByModule.size();
    }
}
