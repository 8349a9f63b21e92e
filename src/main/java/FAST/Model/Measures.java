package FAST.Model;

/**
 * The raw measures behind a score.
 * @param size - number of AST nodes
 * @param generalization - share of the prefix tree states removed by merging, in [0, 1)
 * @param overgeneralization - language density gained over the sample itself, in [0, 1]
 * @param density - language density of the source automaton, in [0, 1]
 */
public record Measures(int size, double generalization, double overgeneralization, double density) { }
