package fastcalib.registration;

/**
 * Background suppression applied to both volumes before registration
 */
public enum ThresholdMode
{
 None, Otsu
}
