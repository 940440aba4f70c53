package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A named container of declarations, tagged with the source file it was parsed from.
 * Packages are the merge unit of incremental builds: two packages are the same logical
 * package iff both name and file name match.
 */
public final class PackageNode extends Node implements Entity {

    private final String name;
    private final String fileName;
    private final boolean testFile;
    private final List<ImportNode> imports;
    private final List<Node> members;
    private final List<Problem> problems;

    public PackageNode(String name, String fileName, boolean testFile,
                       List<ImportNode> imports, List<? extends Node> members, List<Problem> problems) {
        this.name = name;
        this.fileName = fileName;
        this.testFile = testFile;
        this.imports = List.copyOf(imports);
        this.members = List.copyOf(members);
        this.problems = List.copyOf(problems);
    }

    /**
     * Creates a package without imports or problems.
     */
    public PackageNode(String name, String fileName, boolean testFile, List<? extends Node> members) {
        this(name, fileName, testFile, List.of(), members, List.of());
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * @return The source file identifier, or null for packages that do not come from a file.
     */
    public String fileName() {
        return fileName;
    }

    public boolean isTestFile() {
        return testFile;
    }

    public List<ImportNode> imports() {
        return imports;
    }

    /**
     * Members are entities (classes, singletons, nested packages, programs, tests, variables).
     */
    public List<Node> members() {
        return members;
    }

    public List<Problem> problems() {
        return problems;
    }

    /**
     * Creates a copy of this package with different contents. Name, file name and test flag
     * are kept.
     */
    public PackageNode withContents(List<ImportNode> imports, List<? extends Node> members, List<Problem> problems) {
        PackageNode copy = new PackageNode(name, fileName, testFile, imports, members, problems);
        copy.setId(id());
        return copy;
    }

    @Override
    public List<Node> children() {
        return childrenOf(imports, members);
    }

    @Override
    protected PackageNode rebuild(UnaryOperator<Node> childMapper) {
        return new PackageNode(name, fileName, testFile, mapAll(imports, childMapper), mapAll(members, childMapper), problems);
    }
}
