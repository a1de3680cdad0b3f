package de.leipzig.htwk.gitrdf.shex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "shex.evaluation")
public class EvaluationConfig {

  private String dataset = "wes";
  private String groundTruthDir = "dataset/wes/ground-truth";
  private String predictedDir = "output/wes/predicted";
  private String fileExtension = ".shex";
  private boolean includeGraphEditDistance = false;

  // Getters and setters
  public String getDataset() {
    return dataset;
  }

  public void setDataset(String dataset) {
    this.dataset = dataset;
  }

  public String getGroundTruthDir() {
    return groundTruthDir;
  }

  public void setGroundTruthDir(String groundTruthDir) {
    this.groundTruthDir = groundTruthDir;
  }

  public String getPredictedDir() {
    return predictedDir;
  }

  public void setPredictedDir(String predictedDir) {
    this.predictedDir = predictedDir;
  }

  public String getFileExtension() {
    return fileExtension;
  }

  public void setFileExtension(String fileExtension) {
    this.fileExtension = fileExtension;
  }

  public boolean isIncludeGraphEditDistance() {
    return includeGraphEditDistance;
  }

  public void setIncludeGraphEditDistance(boolean includeGraphEditDistance) {
    this.includeGraphEditDistance = includeGraphEditDistance;
  }
}
