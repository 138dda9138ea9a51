package com.tba3.mock.generator;

import com.tba3.mock.booklet.BookletModels.Item;

import java.util.*;

public final class ResponseMatrix {
    private final List<Item> items;
    private final int[][] scores;
    private final Map<String, Integer> columnByItemId;

    public ResponseMatrix(List<Item> items, int[][] scores) {
        this.items = List.copyOf(items);
        this.scores = new int[scores.length][];
        for (int row = 0; row < scores.length; row++) {
            if (scores[row].length != items.size()) {
                throw new IllegalArgumentException("row " + row + " has " + scores[row].length
                        + " scores, expected " + items.size());
            }
            this.scores[row] = scores[row].clone();
        }
        Map<String, Integer> columns = new HashMap<>();
        for (int col = 0; col < this.items.size(); col++) {
            columns.putIfAbsent(this.items.get(col).iqbItemId(), col);
        }
        this.columnByItemId = columns;
    }

    public static ResponseMatrix concat(List<ResponseMatrix> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("nothing to concatenate");
        }
        List<Item> layout = parts.get(0).items;
        int rows = 0;
        for (ResponseMatrix part : parts) {
            if (!part.items.equals(layout)) {
                throw new IllegalArgumentException("cannot concatenate matrices with different item columns");
            }
            rows += part.studentCount();
        }
        int[][] stacked = new int[rows][];
        int offset = 0;
        for (ResponseMatrix part : parts) {
            for (int[] row : part.scores) {
                stacked[offset++] = row;
            }
        }
        return new ResponseMatrix(layout, stacked);
    }

    public List<Item> items() {
        return items;
    }

    public int studentCount() {
        return scores.length;
    }

    public int itemCount() {
        return items.size();
    }

    public int score(int student, Item item) {
        return scores[student][columnOf(item)];
    }

    public int[] column(Item item) {
        int col = columnOf(item);
        int[] values = new int[scores.length];
        for (int row = 0; row < scores.length; row++) {
            values[row] = scores[row][col];
        }
        return values;
    }

    public int rawScore(int student, List<Item> scope) {
        int sum = 0;
        for (Item item : scope) {
            sum += scores[student][columnOf(item)];
        }
        return sum;
    }

    public int[] rawScores(List<Item> scope) {
        int[] result = new int[scores.length];
        for (int row = 0; row < scores.length; row++) {
            result[row] = rawScore(row, scope);
        }
        return result;
    }

    public double[] rowMeans(List<Item> scope) {
        double[] means = new double[scores.length];
        for (int row = 0; row < scores.length; row++) {
            means[row] = (double) rawScore(row, scope) / scope.size();
        }
        return means;
    }

    public int[][] toArray() {
        int[][] copy = new int[scores.length][];
        for (int row = 0; row < scores.length; row++) {
            copy[row] = scores[row].clone();
        }
        return copy;
    }

    private int columnOf(Item item) {
        Integer col = columnByItemId.get(item.iqbItemId());
        if (col == null) {
            throw new IllegalArgumentException("item " + item.iqbItemId() + " is not a column of this matrix");
        }
        return col;
    }
}
