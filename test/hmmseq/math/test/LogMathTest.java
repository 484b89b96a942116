package hmmseq.math.test;

import junit.framework.TestCase;
import hmmseq.math.LogMath;
import hmmseq.math.NumberArrays;

public class LogMathTest extends TestCase {

	public void testLogSum() {
		assertEquals(Math.log(0.5), LogMath.logSum(Math.log(0.2), Math.log(0.3)), 1e-12);
		assertEquals(Math.log(0.2), LogMath.logSum(Math.log(0.2), Double.NEGATIVE_INFINITY), 1e-12);
		assertEquals(Math.log(0.3), LogMath.logSum(Double.NEGATIVE_INFINITY, Math.log(0.3)), 1e-12);
		assertEquals(Double.NEGATIVE_INFINITY, LogMath.logSum(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY));
		//Very different magnitudes
		assertEquals(-1.0, LogMath.logSum(-1.0, -1000.0), 1e-12);
		assertEquals(-1000.0+Math.log(2), LogMath.logSum(-1000.0, -1000.0), 1e-9);
	}

	public void testLogProduct() {
		assertEquals(Math.log(0.06), LogMath.logProduct(Math.log(0.2), Math.log(0.3)), 1e-12);
		assertEquals(Double.NEGATIVE_INFINITY, LogMath.logProduct(Double.NEGATIVE_INFINITY, 0));
		assertEquals(Double.NEGATIVE_INFINITY, LogMath.logProduct(-3, Double.NEGATIVE_INFINITY));
	}

	public void testLogAndExp() {
		assertEquals(Double.NEGATIVE_INFINITY, LogMath.log(0));
		assertEquals(0.0, LogMath.exp(Double.NEGATIVE_INFINITY));
		assertEquals(0.25, LogMath.exp(LogMath.log(0.25)), 1e-12);
		double [] logs = LogMath.logs(new double[] {1,0});
		assertEquals(0.0, logs[0], 1e-12);
		assertEquals(Double.NEGATIVE_INFINITY, logs[1]);
	}

	public void testIndexMaximum() {
		assertEquals(-1, NumberArrays.getIndexMaximum(new double[0]));
		assertEquals(1, NumberArrays.getIndexMaximum(new double[] {0.1,0.7,0.7,0.2}));
		assertEquals(0, NumberArrays.getIndexMaximum(new double[] {Double.NEGATIVE_INFINITY,Double.NEGATIVE_INFINITY}));
	}

	public void testCounts() {
		int [] counts = NumberArrays.getCounts(new int[] {0,2,2,1,2}, 4);
		assertEquals(1, counts[0]);
		assertEquals(1, counts[1]);
		assertEquals(3, counts[2]);
		assertEquals(0, counts[3]);
		try {
			NumberArrays.getCounts(new int[] {0,4}, 4);
			fail("Values out of range should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}
}
