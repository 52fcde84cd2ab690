package org.cascadeslot.service.engine;

import org.cascadeslot.model.GridPosition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Grille [ligne][colonne], ligne 0 en haut.
 * <p>
 * Une cellule est soit un symbole, soit un wild, soit vide. Wild et vide restent distincts
 * ici ; ils ne sont confondus avec la sentinelle wild que dans {@link #snapshot()}.
 * Une couche parallèle garde l'index du {@code GoldenSymbolInfo} porté par la cellule
 * et suit la cellule quand elle tombe.
 */
public class Grid {

    static final int EMPTY = Integer.MIN_VALUE;
    static final int WILD = Integer.MIN_VALUE + 1;
    static final int NO_GOLDEN = -1;

    public record CellMove(int column, int fromRow, int toRow) {}

    private final int rows;
    private final int columns;
    private final int wildSymbol;
    private final int[][] cells;
    private final int[][] golden;

    public Grid(int rows, int columns, int wildSymbol) {
        if (rows <= 0 || columns <= 0) throw new IllegalArgumentException("Dimensions de grille invalides");
        this.rows = rows;
        this.columns = columns;
        this.wildSymbol = wildSymbol;
        this.cells = new int[rows][columns];
        this.golden = new int[rows][columns];
        for (int r = 0; r < rows; r++) {
            Arrays.fill(cells[r], EMPTY);
            Arrays.fill(golden[r], NO_GOLDEN);
        }
    }

    /** Construit une grille à partir d'ids ; la valeur {@code wildSymbol} est lue comme un wild. */
    public static Grid of(int[][] symbols, int wildSymbol) {
        Grid g = new Grid(symbols.length, symbols[0].length, wildSymbol);
        for (int r = 0; r < g.rows; r++) {
            if (symbols[r].length != g.columns) throw new IllegalArgumentException("Grille non rectangulaire");
            for (int c = 0; c < g.columns; c++) {
                if (symbols[r][c] == wildSymbol) g.setWild(r, c);
                else g.setSymbol(r, c, symbols[r][c]);
            }
        }
        return g;
    }

    public int rows() { return rows; }
    public int columns() { return columns; }
    public int wildSymbol() { return wildSymbol; }

    public boolean isEmpty(int row, int col) { return cells[row][col] == EMPTY; }
    public boolean isWild(int row, int col) { return cells[row][col] == WILD; }
    public boolean hasSymbol(int row, int col) { return cells[row][col] != EMPTY && cells[row][col] != WILD; }

    /** Id du symbole ; seulement valide si {@link #hasSymbol(int, int)}. */
    public int symbolAt(int row, int col) {
        int v = cells[row][col];
        if (v == EMPTY || v == WILD) throw new IllegalStateException("Pas de symbole en (" + row + "," + col + ")");
        return v;
    }

    /** Vrai si la cellule porte {@code symbol} ou un wild. */
    public boolean matches(int row, int col, int symbol) {
        int v = cells[row][col];
        return v == WILD || (v != EMPTY && v == symbol);
    }

    public void setSymbol(int row, int col, int symbol) {
        if (symbol == wildSymbol) throw new IllegalArgumentException("Utiliser setWild pour la sentinelle wild");
        cells[row][col] = symbol;
    }

    public void setWild(int row, int col) {
        cells[row][col] = WILD;
    }

    public void clear(int row, int col) {
        cells[row][col] = EMPTY;
        golden[row][col] = NO_GOLDEN;
    }

    public int goldenIndex(int row, int col) { return golden[row][col]; }
    public void setGolden(int row, int col, int infoIndex) { golden[row][col] = infoIndex; }
    public void clearGolden(int row, int col) { golden[row][col] = NO_GOLDEN; }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < columns;
    }

    public int emptyCount() {
        int n = 0;
        for (int r = 0; r < rows; r++) for (int c = 0; c < columns; c++) if (cells[r][c] == EMPTY) n++;
        return n;
    }

    public int nonEmptyCount(int col) {
        int n = 0;
        for (int r = 0; r < rows; r++) if (cells[r][col] != EMPTY) n++;
        return n;
    }

    public List<GridPosition> wildPositions() {
        List<GridPosition> res = new ArrayList<>();
        for (int r = 0; r < rows; r++) for (int c = 0; c < columns; c++) if (cells[r][c] == WILD) res.add(new GridPosition(r, c));
        return res;
    }

    /**
     * Tasse les cellules non vides de la colonne vers le bas en gardant leur ordre.
     * Les cellules vidées restent en haut. Renvoie les déplacements effectifs.
     */
    public List<CellMove> collapseColumn(int col) {
        List<CellMove> moves = new ArrayList<>();
        int write = rows - 1;
        for (int read = rows - 1; read >= 0; read--) {
            if (cells[read][col] == EMPTY) continue;
            if (read != write) {
                cells[write][col] = cells[read][col];
                golden[write][col] = golden[read][col];
                cells[read][col] = EMPTY;
                golden[read][col] = NO_GOLDEN;
                moves.add(new CellMove(col, read, write));
            }
            write--;
        }
        return moves;
    }

    /** Copie [ligne][colonne] ; wild et vide sont exportés avec la sentinelle wild. */
    public int[][] snapshot() {
        int[][] out = new int[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                int v = cells[r][c];
                out[r][c] = (v == EMPTY || v == WILD) ? wildSymbol : v;
            }
        }
        return out;
    }

    public Grid copy() {
        Grid g = new Grid(rows, columns, wildSymbol);
        for (int r = 0; r < rows; r++) {
            System.arraycopy(cells[r], 0, g.cells[r], 0, columns);
            System.arraycopy(golden[r], 0, g.golden[r], 0, columns);
        }
        return g;
    }
}
