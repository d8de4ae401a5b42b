package dev.graphrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the GraphRAG retrieval service. Serves the MCP tools over the stdio transport.
 */
@SpringBootApplication
public class GraphRagApplication {
  public static void main(String[] args) {
    SpringApplication.run(GraphRagApplication.class, args);
  }
}
