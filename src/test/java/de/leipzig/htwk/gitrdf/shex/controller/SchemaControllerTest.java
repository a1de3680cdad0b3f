package de.leipzig.htwk.gitrdf.shex.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.leipzig.htwk.gitrdf.shex.model.CommentKind;
import de.leipzig.htwk.gitrdf.shex.model.CommentRecord;

@SpringBootTest
@AutoConfigureMockMvc
public class SchemaControllerTest {

  private static final String PERSON = String.join("\n",
      "PREFIX ex: <http://example.org/>",
      "",
      "start = @ex:Person",
      "",
      "ex:Person {",
      "  ex:name LITERAL ;  # display name",
      "  ex:knows @ex:Person *",
      "}");

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper objectMapper;

  private String json(Object body) throws Exception {
    return objectMapper.writeValueAsString(body);
  }

  @Test
  public void postShexcShouldReturnShexjWithMetadata() throws Exception {
    mockMvc.perform(MockMvcRequestBuilders.post("/api/schemas/shexj")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("shexc", PERSON))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.shexj").value(containsString("\"TripleConstraint\"")))
        .andExpect(jsonPath("$.prefixes.ex").value("http://example.org/"))
        .andExpect(jsonPath("$.comments[0].text").value("# display name"))
        .andExpect(jsonPath("$.comments[0].kind").value("CONSTRAINT"))
        .andExpect(jsonPath("$.droppedLines").isEmpty());
  }

  @Test
  public void postUnrecoverableShexcShouldReturn400WithStrippedLines() throws Exception {
    String broken = String.join("\n",
        "PREFIX ex: <http://example.org/>",
        "ex:Person {",
        "  ex:name LITERAL ;",
        "  ex:knows @ex:Person *");

    mockMvc.perform(MockMvcRequestBuilders.post("/api/schemas/shexj")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("shexc", broken))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.droppedLines[0]").value(4));
  }

  @Test
  public void postBlankShexcShouldReturn400() throws Exception {
    mockMvc.perform(MockMvcRequestBuilders.post("/api/schemas/shexj")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("shexc", "  "))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value(containsString("Invalid request")));
  }

  @Test
  public void postShexjShouldReturnShexcWithComments() throws Exception {
    String shexj = """
        {
          "type": "Schema",
          "start": "http://example.org/Person",
          "shapes": [ {
            "type": "Shape",
            "id": "http://example.org/Person",
            "expression": {
              "type": "TripleConstraint",
              "predicate": "http://example.org/name",
              "valueExpr": { "type": "NodeConstraint", "nodeKind": "literal" }
            }
          } ]
        }
        """;
    Map<String, Object> body = Map.of(
        "shexj", shexj,
        "prefixes", Map.of("ex", "http://example.org/"),
        "comments", List.of(new CommentRecord("# display name", CommentKind.CONSTRAINT, "  ex:name LITERAL")));

    mockMvc.perform(MockMvcRequestBuilders.post("/api/schemas/shexc")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(body)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.shexc").value(String.join("\n",
            "PREFIX ex: <http://example.org/>",
            "",
            "start = @ex:Person",
            "",
            "ex:Person {",
            "  ex:name LITERAL  # display name",
            "}")));
  }

  @Test
  public void postMalformedShexjShouldReturn400() throws Exception {
    mockMvc.perform(MockMvcRequestBuilders.post("/api/schemas/shexc")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("shexj", "{ not json"))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false));
  }

  @Test
  public void postSimilarityShouldReturnDistances() throws Exception {
    String predicted = PERSON.replace("@ex:Person *", "@ex:Person");
    Map<String, Object> body = Map.of(
        "groundTruth", PERSON,
        "predicted", predicted,
        "shapeId", "http://example.org/Person",
        "includeGraphEditDistance", true);

    mockMvc.perform(MockMvcRequestBuilders.post("/api/schemas/similarity")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(body)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.treeEditDistance").value(1))
        .andExpect(jsonPath("$.groundTruthTreeSize").value(6))
        .andExpect(jsonPath("$.normalizedTreeEditDistance").value(closeTo(1.0 / 18.0, 1e-9), Double.class))
        .andExpect(jsonPath("$.graphEditDistance").value(3.0))
        .andExpect(jsonPath("$.graphEditDistanceTimedOut").value(false));
  }

  @Test
  public void postSimilarityWithoutPredictionShouldReturn400() throws Exception {
    mockMvc.perform(MockMvcRequestBuilders.post("/api/schemas/similarity")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("groundTruth", PERSON))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false));
  }
}
