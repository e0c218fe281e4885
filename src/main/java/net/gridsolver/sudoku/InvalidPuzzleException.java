// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

/**
 * Thrown when a puzzle is malformed: wrong dimensions, values out of range, an unreadable
 * board string, or two equal givens sharing a row, column or box.
 */
public class InvalidPuzzleException extends IllegalArgumentException {
    public InvalidPuzzleException(String message) {
        super(message);
    }
}
