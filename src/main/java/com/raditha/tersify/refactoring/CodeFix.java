package com.raditha.tersify.refactoring;

import com.github.javaparser.ast.CompilationUnit;

/**
 * A fix applied to a copy of a compilation unit.
 *
 * @param editedTree  the edited copy; the tree the fix was computed from is unchanged
 * @param description what the fix did
 */
public record CodeFix(CompilationUnit editedTree, String description) {
}
