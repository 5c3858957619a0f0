package io.github.eutro.funcir.ir;

/**
 * The sort (type) of a node: either a bit-vector of some width,
 * or a memory with an address width and a data width.
 */
public final class Sort {
    // dataWidth == 0 for bit-vectors
    private final int widthOrAddr;
    private final int dataWidth;

    private Sort(int widthOrAddr, int dataWidth) {
        this.widthOrAddr = widthOrAddr;
        this.dataWidth = dataWidth;
    }

    /**
     * The sort of a bit-vector.
     *
     * @param width The width in bits, positive.
     * @return The sort.
     */
    public static Sort bits(int width) {
        if (width <= 0) throw new IllegalArgumentException("bit-vector width must be positive, got " + width);
        return new Sort(width, 0);
    }

    /**
     * The sort of a memory.
     *
     * @param addrWidth The width of an address, positive.
     * @param dataWidth The width of a word, positive.
     * @return The sort.
     */
    public static Sort memory(int addrWidth, int dataWidth) {
        if (addrWidth <= 0 || dataWidth <= 0) {
            throw new IllegalArgumentException("memory widths must be positive, got " + addrWidth + ", " + dataWidth);
        }
        return new Sort(addrWidth, dataWidth);
    }

    public boolean isSignal() {
        return dataWidth == 0;
    }

    public boolean isMemory() {
        return dataWidth != 0;
    }

    /**
     * Get the width of a bit-vector sort.
     *
     * @return The width.
     * @throws SortException If this is a memory sort.
     */
    public int width() {
        if (isMemory()) throw new SortException("width() of memory sort " + this);
        return widthOrAddr;
    }

    /**
     * Get the address width of a memory sort.
     *
     * @return The address width.
     * @throws SortException If this is a bit-vector sort.
     */
    public int addrWidth() {
        if (isSignal()) throw new SortException("addrWidth() of bit-vector sort " + this);
        return widthOrAddr;
    }

    /**
     * Get the data width of a memory sort.
     *
     * @return The data width.
     * @throws SortException If this is a bit-vector sort.
     */
    public int dataWidth() {
        if (isSignal()) throw new SortException("dataWidth() of bit-vector sort " + this);
        return dataWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sort)) return false;
        Sort sort = (Sort) o;
        return widthOrAddr == sort.widthOrAddr && dataWidth == sort.dataWidth;
    }

    @Override
    public int hashCode() {
        return 31 * widthOrAddr + dataWidth;
    }

    @Override
    public String toString() {
        return isSignal()
                ? "bit[" + widthOrAddr + "]"
                : "memory[" + widthOrAddr + ", " + dataWidth + "]";
    }
}
