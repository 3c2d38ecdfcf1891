/**
 * NetCDF classic (CDF-1) output.
 * <p>No NetCDF library is involved; {@code ClassicNetcdfEncoder} writes the format directly.</p>
 */
package ca.gc.cra.dfmet.infrastructure.persistence.netcdf;
