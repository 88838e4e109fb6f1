package dev.runbar.installed;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SystemPathFilterTest {

  private final SystemPathFilter filter = new SystemPathFilter("/Users/test");

  @ParameterizedTest
  @CsvSource({
    "/System/Applications/Utilities/Terminal.app, true",
    "/System/Library/CoreServices/Finder.app, true",
    "/Library/Application Support/Helper.app, true",
    "/Users/test/Library/Application Support/Tool.app, true",
    "/users/TEST/library/Caches/Thing.app, true",
    "/Applications/Xcode.app/Contents/Applications/Instruments.app, true",
    "/System/Volumes/Data/Library/Updater.app, true",
    "/Applications/Utilities/Terminal.app, false",
    "/Applications/Firefox.app, false",
    "/System/Volumes/Data/Applications/Firefox.app, false",
    "/System/Volumes/Preboot/Tool.app, false",
    "/Users/test/Applications/Notes.app, false",
    "/Users/other/Library/Tool.app, false",
    "/usr/share/applications/gimp.desktop, false"
  })
  void classifies_program_locations(String path, boolean systemOrEmbedded) {
    assertThat(filter.isSystemOrEmbedded(path)).isEqualTo(systemOrEmbedded);
  }

  @ParameterizedTest
  @CsvSource({
    "/system/volumes/data/applications/x.app, /applications/x.app",
    "/system/volumes/data, /",
    "/applications/x.app, /applications/x.app"
  })
  void data_volume_alias_is_collapsed(String lowerPath, String normalized) {
    assertThat(SystemPathFilter.normalize(lowerPath)).isEqualTo(normalized);
  }

  @ParameterizedTest
  @CsvSource({"/Users/test", "/Users/test/"})
  void home_library_ignores_trailing_slash(String home) {
    assertThat(new SystemPathFilter(home).isSystemOrEmbedded("/Users/test/Library/X.app"))
        .isTrue();
  }
}
