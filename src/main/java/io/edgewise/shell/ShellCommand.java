package io.edgewise.shell;

public enum ShellCommand {
    CREATE("create", "<directed|undirected> [size]", "Create a graph, optionally with vertices 0..size-1"),
    LOAD("load", "<path> [directed|undirected]", "Load a graph from a file"),
    ADD_VERTEX("add_vertex", "<v>", "Add a vertex"),
    ADD_EDGE("add_edge", "<u> <v> [weight]", "Add an edge, or replace its weight"),
    REMOVE_VERTEX("remove_vertex", "<v>", "Remove a vertex and its edges"),
    REMOVE_EDGE("remove_edge", "<u> <v>", "Remove an edge"),
    LIST_VERTICES("list_vertices", "", "List all vertices"),
    LIST_EDGES("list_edges", "[v]", "List all edges, or the edges of one vertex"),
    CONNECTED("connected", "", "Check whether the graph is connected"),
    COMPONENTS("components", "", "List connected components"),
    SHORTEST_PATH("shortest_path", "<source> <target>", "Shortest path between two vertices"),
    DISTANCES("distances", "<source>", "Distances from a vertex to all others"),
    MST("mst", "<start>", "Minimum spanning tree (Prim)"),
    INFO("info", "", "Graph summary"),
    HELP("help", "", "Show this help"),
    EXIT("exit", "", "Leave the shell");

    private final String name;
    private final String arguments;
    private final String description;

    ShellCommand(String name, String arguments, String description) {
        this.name = name;
        this.arguments = arguments;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getUsage() {
        return arguments.isEmpty() ? name : name + " " + arguments;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the command, or null if the name is unknown
     */
    public static ShellCommand fromName(String name) {
        String normalized = name.toLowerCase();

        if (normalized.equals("quit")) {
            return EXIT;
        }

        for (ShellCommand command : values()) {
            if (command.name.equals(normalized)) {
                return command;
            }
        }

        return null;
    }
}
