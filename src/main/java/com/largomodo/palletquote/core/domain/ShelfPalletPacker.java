package com.largomodo.palletquote.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Best-fit decreasing pallet packer using greedy shelf placement.
 * <p>
 * Greedy vs optimal tradeoff: exact 3D bin packing is NP-hard, so units are laid
 * in rows and layers per pallet (see {@link ShelfCursor}) and pallets are filled
 * one after another. Largest units go first, which is where packing density
 * matters most.
 * <p>
 * Container model: the floor is divided into a grid of pallet footprints (both
 * pallet orientations are tried, the one with more positions wins). Each position
 * holds one pallet whose goods may rise to the container ceiling.
 */
public class ShelfPalletPacker implements PalletPacker {

    public static final double DEFAULT_EPSILON = 1e-6;

    private static final Logger log = LoggerFactory.getLogger(ShelfPalletPacker.class);

    /**
     * Volume descending, weight descending, height ascending, then identity so that
     * the caller's list order never influences the result.
     */
    static final Comparator<ProductRequest> LOADING_ORDER = Comparator
            .comparingDouble(ShelfPalletPacker::unitVolume).reversed()
            .thenComparing(Comparator.comparingDouble(ShelfPalletPacker::unitWeight).reversed())
            .thenComparingDouble(r -> r.product().dimensions().height())
            .thenComparing(r -> r.product().id(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(r -> r.product().name(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(r -> r.product().sku(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparingInt(ProductRequest::quantity);

    private final double epsilon;
    private final boolean allowRotation;

    public ShelfPalletPacker() {
        this(DEFAULT_EPSILON, true);
    }

    /**
     * @param epsilon       tolerance for dimension comparisons, in centimeters
     * @param allowRotation whether units may be turned 90 degrees about the vertical axis
     */
    public ShelfPalletPacker(double epsilon, boolean allowRotation) {
        if (epsilon < 0) {
            throw new IllegalArgumentException("epsilon cannot be negative: " + epsilon);
        }
        this.epsilon = epsilon;
        this.allowRotation = allowRotation;
    }

    @Override
    public PackingPlan pack(List<ProductRequest> requests, Container container, PalletTemplate pallet) {
        if (requests == null) {
            throw new IllegalArgumentException("Requests list cannot be null");
        }
        if (container == null || pallet == null) {
            throw new IllegalArgumentException("Container and pallet template are required");
        }

        Dimensions containerDims = container.dimensions();
        Dimensions deck = pallet.dimensions();
        double stackHeight = containerDims.height() - deck.height();

        // Fail-fast validation: reject items that cannot fit before any placement starts
        for (ProductRequest request : requests) {
            if (!fitsSomeOrientation(request.product().dimensions(),
                    containerDims.length(), containerDims.width(), containerDims.height())) {
                throw new OversizedProductException("Product " + request.product().displayName(), "container");
            }
        }
        FloorGrid grid = FloorGrid.of(containerDims, deck, epsilon);
        if (grid.slots() == 0 || stackHeight <= epsilon) {
            throw new OversizedProductException("Pallet template", "container");
        }
        for (ProductRequest request : requests) {
            if (!fitsSomeOrientation(request.product().dimensions(), deck.length(), deck.width(), stackHeight)) {
                throw new OversizedProductException("Product " + request.product().displayName(), "pallet");
            }
        }

        log.debug("Container floor holds {} pallet position(s) ({} x {}, turned={}), stack height {} cm",
                grid.slots(), grid.columns(), grid.rows(), grid.turned(), stackHeight);

        List<ProductRequest> ordered = new ArrayList<>(requests);
        ordered.sort(LOADING_ORDER);
        int[] remaining = ordered.stream().mapToInt(ProductRequest::quantity).toArray();

        List<PalletLoad> loads = new ArrayList<>();
        double grossWeight = 0;

        for (int slot = 0; slot < grid.slots() && !allPlaced(remaining); slot++) {
            if (exceeds(grossWeight + pallet.tareWeight(), container.maxWeight())) {
                log.debug("Container weight limit reached before opening pallet {}", slot + 1);
                break;
            }

            PalletLoad load = loadPallet(ordered, remaining, pallet, stackHeight, grid, slot,
                    grossWeight + pallet.tareWeight(), container.maxWeight());

            // Every pallet starts empty and identical, so an empty one means nothing more fits anywhere
            if (load.placements().isEmpty()) {
                break;
            }
            grossWeight += pallet.tareWeight() + load.goodsWeight();
            loads.add(load);
            log.debug("Pallet {} loaded with {} unit(s), {} kg goods", slot + 1, load.unitCount(), load.goodsWeight());
        }

        List<ProductRequest> unplaced = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            if (remaining[i] > 0) {
                unplaced.add(ordered.get(i).withQuantity(remaining[i]));
            }
        }
        return new PackingPlan(loads, unplaced, grid.slots());
    }

    private PalletLoad loadPallet(List<ProductRequest> ordered, int[] remaining, PalletTemplate pallet,
                                  double stackHeight, FloorGrid grid, int slot,
                                  double grossBeforeGoods, Double containerMaxWeight) {
        Dimensions deck = pallet.dimensions();
        ShelfCursor cursor = new ShelfCursor(deck.length(), deck.width(), stackHeight, epsilon);
        RunCollector runs = new RunCollector(epsilon);
        double goodsWeight = 0;
        double goodsVolume = 0;

        for (int i = 0; i < ordered.size(); i++) {
            Product product = ordered.get(i).product();
            double weight = unitWeight(ordered.get(i));
            List<ShelfCursor.Footprint> options = orientations(product.dimensions());
            String label = product.id() != null ? product.id() : product.displayName();

            // Spill to the next pallet on the first constraint this product hits; smaller products may still fit
            while (remaining[i] > 0) {
                if (exceeds(goodsWeight + weight, pallet.maxWeight())) {
                    break;
                }
                if (exceeds(grossBeforeGoods + goodsWeight + weight, containerMaxWeight)) {
                    break;
                }
                ShelfCursor.Slot placed = cursor.place(options);
                if (placed == null) {
                    break;
                }
                runs.add(i, label, placed);
                remaining[i]--;
                goodsWeight += weight;
                goodsVolume += product.dimensions().volume();
            }
        }

        return new PalletLoad(grid.origin(slot), grid.turned(), runs.placements(), goodsWeight, goodsVolume);
    }

    private List<ShelfCursor.Footprint> orientations(Dimensions d) {
        ShelfCursor.Footprint asGiven = new ShelfCursor.Footprint(d.length(), d.width(), d.height(), false);
        if (!allowRotation || Math.abs(d.length() - d.width()) <= epsilon) {
            return List.of(asGiven);
        }
        return List.of(asGiven, new ShelfCursor.Footprint(d.width(), d.length(), d.height(), true));
    }

    private boolean fitsSomeOrientation(Dimensions d, double length, double width, double height) {
        for (ShelfCursor.Footprint f : orientations(d)) {
            if (f.length() <= length + epsilon && f.width() <= width + epsilon && f.height() <= height + epsilon) {
                return true;
            }
        }
        return false;
    }

    private boolean exceeds(double weight, Double limit) {
        return limit != null && weight > limit + epsilon;
    }

    private static boolean allPlaced(int[] remaining) {
        for (int quantity : remaining) {
            if (quantity > 0) {
                return false;
            }
        }
        return true;
    }

    private static double unitVolume(ProductRequest request) {
        return request.product().dimensions().volume();
    }

    private static double unitWeight(ProductRequest request) {
        Double weight = request.product().weight();
        return weight == null ? 0.0 : weight;
    }

    /**
     * Pallet positions on the container floor, row-major from the container's near corner.
     */
    private record FloorGrid(int columns, int rows, double stepX, double stepY, boolean turned) {

        static FloorGrid of(Dimensions container, Dimensions deck, double epsilon) {
            int columns = fitCount(container.length(), deck.length(), epsilon);
            int rows = fitCount(container.width(), deck.width(), epsilon);
            int turnedColumns = fitCount(container.length(), deck.width(), epsilon);
            int turnedRows = fitCount(container.width(), deck.length(), epsilon);

            if (turnedColumns * turnedRows > columns * rows) {
                return new FloorGrid(turnedColumns, turnedRows, deck.width(), deck.length(), true);
            }
            return new FloorGrid(columns, rows, deck.length(), deck.width(), false);
        }

        private static int fitCount(double span, double unit, double epsilon) {
            if (unit <= 0) {
                return 0;
            }
            return (int) Math.floor((span + epsilon) / unit);
        }

        int slots() {
            return columns * rows;
        }

        Position origin(int slot) {
            return new Position((slot % columns) * stepX, (slot / columns) * stepY, 0);
        }
    }

    /**
     * Merges consecutive units of the same request and orientation in one row into a single placement.
     */
    private static final class RunCollector {
        private final double epsilon;
        private final List<Placement> placements = new ArrayList<>();

        private int request = -1;
        private String productId;
        private ShelfCursor.Slot first;
        private double nextX;
        private int count;

        RunCollector(double epsilon) {
            this.epsilon = epsilon;
        }

        void add(int requestIndex, String id, ShelfCursor.Slot slot) {
            if (count > 0 && continuesRun(requestIndex, slot)) {
                count++;
            } else {
                flush();
                request = requestIndex;
                productId = id;
                first = slot;
                count = 1;
            }
            nextX = slot.position().x() + slot.footprint().length();
        }

        private boolean continuesRun(int requestIndex, ShelfCursor.Slot slot) {
            return request == requestIndex
                    && first.footprint().equals(slot.footprint())
                    && Math.abs(slot.position().x() - nextX) <= epsilon
                    && slot.position().y() == first.position().y()
                    && slot.position().z() == first.position().z();
        }

        private void flush() {
            if (count > 0) {
                Rotation rotation = first.footprint().turned() ? Rotation.QUARTER_TURN : Rotation.NONE;
                placements.add(new Placement(productId, count, first.position(), rotation));
            }
            count = 0;
        }

        List<Placement> placements() {
            flush();
            return placements;
        }
    }
}
