package exm.sct.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.io.FileUtils;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.sct.common.Logging;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.exceptions.SCTFatal;

public class SCTDriverTest {

  private static final String SOURCE =
      "module kernels\n" +
      "contains\n" +
      "  subroutine axpy(x, y, n)\n" +
      "    integer, intent(in) :: n\n" +
      "    real, dimension(n), intent(in) :: x\n" +
      "    real, dimension(n), intent(inout) :: y\n" +
      "    integer :: i\n" +
      "    do i = 1, n\n" +
      "      y(i) = ABS(x(i)) + y(i)\n" +
      "    end do\n" +
      "  end subroutine axpy\n" +
      "  subroutine scale(y, n)\n" +
      "    integer, intent(in) :: n\n" +
      "    real, dimension(n), intent(inout) :: y\n" +
      "    integer :: i\n" +
      "    do i = 1, n\n" +
      "      y(i) = 2.0 * y(i)\n" +
      "    end do\n" +
      "  end subroutine scale\n" +
      "end module kernels\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static SCTDriver driver(Settings settings) {
    return new SCTDriver(Logging.getSCTLogger(), settings);
  }

  private static List<String> noSteps() {
    return Collections.emptyList();
  }

  private File write(String name, String text) throws Exception {
    File f = tmp.newFile(name);
    FileUtils.writeStringToFile(f, text, "UTF-8");
    return f;
  }

  /**
   * Run the driver, returning the exit code it fails with, or 0
   */
  private static int exitCode(SCTDriver driver, File input, File output,
                              List<String> steps) {
    try {
      driver.run(input.getPath(),
                 output == null ? null : output.getPath(), steps);
      return ExitCode.SUCCESS.code();
    } catch (SCTFatal e) {
      return e.exitCode;
    }
  }

  @Test
  public void testProcessWithoutSteps() throws Exception {
    String text = driver(Settings.defaultSettings())
                            .process(SOURCE, "kernels.f90", noSteps());
    assertTrue(text, text.startsWith("module kernels\n"));
    assertTrue(text, text.contains("    do i = 1, n, 1\n" +
                                   "      y(i) = ABS(x(i)) + y(i)\n" +
                                   "    end do\n"));
    assertTrue(text, text.endsWith("end module kernels\n"));
  }

  @Test
  public void testProcessSteps() throws Exception {
    String text = driver(Settings.defaultSettings()).process(SOURCE,
        "kernels.f90", Arrays.asList("Abs2CodeTrans",
                                     "ProfileTrans:routine=scale"));
    assertTrue(text, text.contains("if (tmp_abs < 0.0) then\n"));
    assertTrue(text, text.contains(
        "call profile_psy_data%PreStart(\"kernels\", \"scale-r0\", 0, 0)\n"));
    assertTrue(text, text.contains("use profile_psy_data_mod, only: " +
                                   "profile_PSyDataType\n"));
  }

  @Test
  public void testProcessBadStep() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Unknown transformation 'Abs2Code'");
    driver(Settings.defaultSettings()).process(SOURCE, "kernels.f90",
        Arrays.asList("Abs2Code"));
  }

  @Test
  public void testCBackend() throws Exception {
    Settings c = Settings.defaultSettings().with(Settings.BACKEND, "c");
    String text = driver(c).process(SOURCE, "kernels.f90", noSteps());
    assertEquals(
        "void axpy(double x[n], double y[n], int n)\n" +
        "{\n" +
        "  int i;\n" +
        "  for (i = 1; i <= n; i += 1) {\n" +
        "    y[i] = fabs(x[i]) + y[i];\n" +
        "  }\n" +
        "}\n" +
        "\n" +
        "void scale(double y[n], int n)\n" +
        "{\n" +
        "  int i;\n" +
        "  for (i = 1; i <= n; i += 1) {\n" +
        "    y[i] = 2.0 * y[i];\n" +
        "  }\n" +
        "}\n", text);
  }

  @Test
  public void testRunWritesOutput() throws Exception {
    File input = write("kernels.f90", SOURCE);
    File output = new File(tmp.getRoot(), "out.f90");
    assertEquals(0, exitCode(driver(Settings.defaultSettings()), input,
                             output, Arrays.asList("LoopSwapTrans")));
    String text = FileUtils.readFileToString(output, "UTF-8");
    assertTrue(text, text.startsWith("module kernels\n"));
  }

  @Test
  public void testRunMissingInput() throws Exception {
    File missing = new File(tmp.getRoot(), "missing.f90");
    assertEquals(ExitCode.ERROR_IO.code(), exitCode(
        driver(Settings.defaultSettings()), missing, null, noSteps()));
  }

  @Test
  public void testRunSyntaxError() throws Exception {
    File input = write("bad.f90",
        "subroutine s()\n" +
        "  integer :: i\n" +
        "  do i = 1, 10\n" +
        "end subroutine s\n");
    assertEquals(ExitCode.ERROR_SYNTAX.code(), exitCode(
        driver(Settings.defaultSettings()), input, null, noSteps()));
  }

  @Test
  public void testRunUserError() throws Exception {
    File input = write("kernels.f90", SOURCE);
    assertEquals(ExitCode.ERROR_USER.code(), exitCode(
        driver(Settings.defaultSettings()), input, null,
        Arrays.asList("BlockLoopTrans:target=nowhere")));
  }

  @Test
  public void testRunBackendError() throws Exception {
    File input = write("printing.f90",
        "subroutine s()\n" +
        "  print *, 'hello'\n" +
        "end subroutine s\n");
    Settings c = Settings.defaultSettings().with(Settings.BACKEND, "c");
    assertEquals("Backend failures are user errors",
        ExitCode.ERROR_USER.code(), exitCode(driver(c), input, null,
                                             noSteps()));
  }

  @Test
  public void testCommandLine() throws Exception {
    String[] args = {"-t", "LoopSwapTrans", "--transform",
                     "ProfileTrans:routine=scale", "-b", "c", "-m",
                     "-Dsct.trans.blocksize=8", "in.f90", "out.c"};
    CommandLine cmd = new GnuParser().parse(Main.initOptions(), args);
    Main.Args parsed = Main.buildArgs(cmd, cmd.getArgs());
    assertEquals("in.f90", parsed.inputFilename);
    assertEquals("out.c", parsed.outputFilename);
    assertEquals(Arrays.asList("LoopSwapTrans",
                               "ProfileTrans:routine=scale"), parsed.steps);
    assertEquals("c", parsed.overrides.getProperty(Settings.BACKEND));
    assertEquals("true",
        parsed.overrides.getProperty(Settings.DISTRIBUTED_MEMORY));
    assertEquals("8",
        parsed.overrides.getProperty(Settings.TRANS_BLOCKSIZE));
    assertNull(parsed.overrides.getProperty(Settings.LOG_TRACE));

    Settings settings = Settings.create(parsed.overrides);
    assertEquals(8, settings.getInt(Settings.TRANS_BLOCKSIZE));
    assertEquals("c", settings.getBackend());
  }

  @Test
  public void testCommandLineInputOnly() throws Exception {
    CommandLine cmd = new GnuParser().parse(Main.initOptions(),
                                      new String[] {"-v", "in.f90"});
    Main.Args parsed = Main.buildArgs(cmd, cmd.getArgs());
    assertNull(parsed.outputFilename);
    assertTrue(parsed.steps.isEmpty());
    assertEquals("true", parsed.overrides.getProperty(Settings.LOG_TRACE));
  }
}
