package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.metricshub.jbash.JbashTestSupport.shellTest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jbash.command.CatCommand;
import org.metricshub.jbash.runtime.Session;

public class CatCommandTest {

	@Test
	public void testCopiesStandardInput() {
		shellTest("cat").stdin("abc\ndef\n").script("cat").expectLines("abc", "def").runAndAssert();
		shellTest("utf-8 input").stdin("é😀").script("cat").expect("é😀").runAndAssert();
		shellTest("empty input").script("cat").expect("").runAndAssert();
		shellTest("arguments are ignored").stdin("in").script("cat file").expect("in").runAndAssert();
	}

	@Test
	public void testInputIsConsumed() {
		shellTest("second cat reads nothing").stdin("once").script("cat; cat").expect("once").runAndAssert();
	}

	@Test
	public void testReadFailure() {
		InputStream failing = new InputStream() {
			@Override
			public int read() throws IOException {
				throw new IOException("broken");
			}
		};
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		PrintStream stream = new PrintStream(out, true, StandardCharsets.UTF_8);
		Session session = new Jbash().newSession(failing, stream, stream);
		JbashException e = assertThrows(
				JbashException.class,
				() -> new CatCommand().run(Collections.<String>emptyList(), session));
		assertEquals(JbashStatus.ERROR, e.getStatus());
	}
}
