package org.tvmsol.semantic;

import org.tvmsol.util.TvmVersion;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The one place that knows which features each VM version lacks.
 */
public final class VmFeatureGate
{
	public static final String NOT_SUPPORTED_BY_VM = " is not supported by the VM version. See \"--tvm-version\" command-line option.";

	private static final Map<VmFeature, Set<TvmVersion>> UNSUPPORTED_ON;

	static
	{
		Map<VmFeature, Set<TvmVersion>> map = new EnumMap<>(VmFeature.class);
		map.put(VmFeature.TVM_INIT_CODE_HASH, EnumSet.of(TvmVersion.TON));
		map.put(VmFeature.TVM_CODE, EnumSet.of(TvmVersion.TON));
		map.put(VmFeature.AWAIT, EnumSet.of(TvmVersion.TON));
		map.put(VmFeature.COPYLEFT_PRAGMA, EnumSet.of(TvmVersion.TON));
		map.put(VmFeature.TX_STORAGE_FEE, EnumSet.of(TvmVersion.TON));
		// The gosh namespace only exists on its own VM family.
		map.put(VmFeature.GOSH_NAMESPACE, EnumSet.complementOf(EnumSet.of(TvmVersion.GOSH)));

		for (VmFeature feature : VmFeature.values())
		{
			if (!map.containsKey(feature))
			{
				throw new IllegalStateException("No VM support entry for " + feature);
			}
		}
		UNSUPPORTED_ON = Collections.unmodifiableMap(map);
	}

	private VmFeatureGate()
	{
	}

	public static boolean isSupported(VmFeature feature, TvmVersion version)
	{
		return !UNSUPPORTED_ON.get(feature).contains(version);
	}

	public static Set<TvmVersion> unsupportedVersions(VmFeature feature)
	{
		return Collections.unmodifiableSet(UNSUPPORTED_ON.get(feature));
	}

	public static String notSupportedMessage(String spelling)
	{
		return spelling + NOT_SUPPORTED_BY_VM;
	}
}
