package com.rulesim.domain.vo;

import java.util.List;

/**
 * Symmetric Pearson correlation matrix over a fixed, ordered list of assets.
 *
 * <p>Entries are {@link Double#NaN} where a correlation is undefined (a constant series or
 * fewer than two observations). The diagonal is always 1.
 */
public final class CorrelationMatrix {

    private final List<String> assets;
    private final double[][] values;

    public CorrelationMatrix(List<String> assets, double[][] values) {
        if (values.length != assets.size()) {
            throw new IllegalArgumentException("Matrix size " + values.length + " does not match "
                    + assets.size() + " assets");
        }
        this.assets = List.copyOf(assets);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = values[i].clone();
        }
    }

    public static CorrelationMatrix empty() {
        return new CorrelationMatrix(List.of(), new double[0][0]);
    }

    public List<String> getAssets() {
        return assets;
    }

    public int size() {
        return assets.size();
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    public double get(String rowAsset, String columnAsset) {
        return get(indexOf(rowAsset), indexOf(columnAsset));
    }

    /** Mean of the defined upper-triangle entries, NaN when there are none. */
    public double averagePairwise() {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                if (!Double.isNaN(values[i][j])) {
                    sum += values[i][j];
                    count++;
                }
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    private int indexOf(String asset) {
        int index = assets.indexOf(asset);
        if (index < 0) {
            throw new IllegalArgumentException("Asset not in correlation matrix: " + asset);
        }
        return index;
    }
}
