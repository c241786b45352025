package com.example.datalake.mnemo.indexer;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.mnemo.config.MnemoProperties;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

class FileEligibilityTest {

  private final FileEligibility eligibility = new FileEligibility(new MnemoProperties().getIndexer());

  @Test
  void extensionAllowList() {
    assertThat(eligibility.check(Path.of("/home/u/Projects/notes.md"), 600)).isEqualTo(FileEligibility.Verdict.ELIGIBLE);
    assertThat(eligibility.check(Path.of("/home/u/Projects/NOTES.MD"), 600)).isEqualTo(FileEligibility.Verdict.ELIGIBLE);
    assertThat(eligibility.check(Path.of("/home/u/Projects/photo.png"), 600)).isEqualTo(FileEligibility.Verdict.WRONG_EXTENSION);
    assertThat(eligibility.check(Path.of("/home/u/Projects/secret/.env"), 20)).isEqualTo(FileEligibility.Verdict.WRONG_EXTENSION);
  }

  @Test
  void sensitivePathsAreRejectedWhateverTheExtension() {
    assertThat(eligibility.check(Path.of("/home/u/Projects/app/credentials.json"), 10)).isEqualTo(FileEligibility.Verdict.SENSITIVE);
    assertThat(eligibility.check(Path.of("/home/u/Projects/app/.env.local.txt"), 10)).isEqualTo(FileEligibility.Verdict.SENSITIVE);
    assertThat(eligibility.check(Path.of("/home/u/Documents/Secrets/plan.md"), 10)).isEqualTo(FileEligibility.Verdict.SENSITIVE);
  }

  @Test
  void sizeCeiling() {
    assertThat(eligibility.check(Path.of("/home/u/big.txt"), 500L * 1024 + 1)).isEqualTo(FileEligibility.Verdict.TOO_LARGE);
    assertThat(eligibility.check(Path.of("/home/u/big.txt"), 500L * 1024)).isEqualTo(FileEligibility.Verdict.ELIGIBLE);
  }

  @Test
  void skipsHiddenAndToolDirectories() {
    assertThat(eligibility.shouldDescend(Path.of("/home/u/Projects/app/src"))).isTrue();
    assertThat(eligibility.shouldDescend(Path.of("/home/u/Projects/app/node_modules"))).isFalse();
    assertThat(eligibility.shouldDescend(Path.of("/home/u/Projects/app/.git"))).isFalse();
    assertThat(eligibility.shouldDescend(Path.of("/home/u/Projects/app/.hidden"))).isFalse();
  }

  @Test
  void binaryProbeLooksForNulInPrefixOnly() {
    byte[] late = new byte[100];
    java.util.Arrays.fill(late, (byte) 'a');
    late[90] = 0;

    assertThat(FileEligibility.looksBinary(late, 8192)).isTrue();
    assertThat(FileEligibility.looksBinary(late, 50)).isFalse();
    assertThat(FileEligibility.looksBinary("plain text".getBytes(), 8192)).isFalse();
  }

  @Test
  void dotfilesHaveNoExtension() {
    assertThat(FileEligibility.extensionOf(Path.of(".bashrc"))).isEmpty();
    assertThat(FileEligibility.extensionOf(Path.of("a.tar.GZ"))).isEqualTo(".gz");
  }
}
