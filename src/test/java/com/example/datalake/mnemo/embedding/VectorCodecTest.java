package com.example.datalake.mnemo.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.datalake.mnemo.exception.VectorDimensionException;
import org.junit.jupiter.api.Test;

class VectorCodecTest {

  @Test
  void packsAsLittleEndianFloat32() {
    byte[] packed = VectorCodec.pack(new float[] {1.0f, -2.5f});

    assertThat(packed).hasSize(8);
    // 1.0f = 0x3F800000
    assertThat(packed[0]).isEqualTo((byte) 0x00);
    assertThat(packed[3]).isEqualTo((byte) 0x3F);
    assertThat(VectorCodec.unpack(packed)).containsExactly(1.0f, -2.5f);
  }

  @Test
  void l2DistanceOfKnownVectors() {
    double d = VectorCodec.l2Distance(new float[] {0f, 0f}, new float[] {3f, 4f});

    assertThat(d).isCloseTo(5.0, within(1e-9));
  }

  @Test
  void l2DistanceRejectsMismatchedDimensions() {
    assertThatThrownBy(() -> VectorCodec.l2Distance(new float[2], new float[3]))
        .isInstanceOf(VectorDimensionException.class);
  }

  @Test
  void normalizeProducesUnitLength() {
    float[] v = VectorCodec.normalize(new float[] {3f, 4f});

    assertThat(v[0]).isCloseTo(0.6f, within(1e-6f));
    assertThat(v[1]).isCloseTo(0.8f, within(1e-6f));
  }

  @Test
  void normalizeLeavesZeroVectorAlone() {
    assertThat(VectorCodec.normalize(new float[3])).containsExactly(0f, 0f, 0f);
  }
}
