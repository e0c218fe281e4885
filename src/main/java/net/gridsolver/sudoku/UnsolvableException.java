// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

/**
 * The solver ran out of alternatives without reaching a filled grid.
 */
public class UnsolvableException extends Exception {
    public UnsolvableException(String message) {
        super(message);
    }
}
